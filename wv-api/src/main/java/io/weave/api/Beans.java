package io.weave.api;

import io.weave.governance.Weave;
import io.weave.governance.YieldHandler;
import io.weave.ledger.Ledger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(WeaveProperties.class)
public class Beans {
    @Bean
    Ledger ledger() {
        return new Ledger();
    }

    @Bean
    YieldHandler yieldHandler(WeaveProperties props) {
        return new YieldHandler(props.getApproval().getDefaultTimeout(), props.getApproval().getDefaultStrategy());
    }

    @Bean
    Weave weave(Ledger ledger, YieldHandler yieldHandler) {
        return new Weave(ledger, yieldHandler);
    }
}
