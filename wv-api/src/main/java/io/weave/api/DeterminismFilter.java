package io.weave.api;

import io.weave.core.Determinism;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Runs a request under a deterministic scope when it carries {@code X-WV-Seed}. */
@Component
@Order(5)
public class DeterminismFilter implements Filter {
    static final String SEED_HEADER = "X-WV-Seed";
    static final String NODE_HEADER = "X-WV-Node";

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain) throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        String seedHdr = r.getHeader(SEED_HEADER);
        String nodeHdr = r.getHeader(NODE_HEADER);
        if (seedHdr == null || seedHdr.isBlank()) {
            chain.doFilter(req, res);
            return;
        }
        long seed;
        try {
            seed = Long.parseLong(seedHdr.trim());
        } catch (NumberFormatException e) {
            ((HttpServletResponse) res).sendError(HttpServletResponse.SC_BAD_REQUEST, SEED_HEADER + " must be a long");
            return;
        }
        try {
            Determinism.withDeterminism(nodeHdr, seed, () -> {
                try {
                    chain.doFilter(req, res);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                } catch (ServletException e) {
                    throw new WrappedServletException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (WrappedServletException e) {
            throw e.cause;
        }
    }

    private static final class WrappedServletException extends RuntimeException {
        final ServletException cause;

        WrappedServletException(ServletException cause) {
            super(cause);
            this.cause = cause;
        }
    }
}
