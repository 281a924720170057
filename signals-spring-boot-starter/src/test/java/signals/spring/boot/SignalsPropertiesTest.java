package signals.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import signals.dispatch.RedispatchPolicy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalsPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(SignalsProperties.class);
            assertEquals(RedispatchPolicy.REJECT, props.getRedispatchPolicy());
            assertFalse(props.isLogDispatches());
            assertTrue(props.getPreload().isEmpty());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "signals.redispatch-policy=RESTART",
                "signals.log-dispatches=true",
                "signals.preload[0]=com.example.GameStarted",
                "signals.preload[1]=com.example.ScoreChanged"
        ).run(ctx -> {
            var props = ctx.getBean(SignalsProperties.class);
            assertEquals(RedispatchPolicy.RESTART, props.getRedispatchPolicy());
            assertTrue(props.isLogDispatches());
            assertEquals(List.of("com.example.GameStarted", "com.example.ScoreChanged"), props.getPreload());
        });
    }

    @Test
    void policyBindsCaseInsensitively() {
        runner.withPropertyValues("signals.redispatch-policy=restart").run(ctx -> {
            assertEquals(RedispatchPolicy.RESTART, ctx.getBean(SignalsProperties.class).getRedispatchPolicy());
        });
    }

    @Test
    void unknownPolicyFailsBinding() {
        runner.withPropertyValues("signals.redispatch-policy=QUEUE").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
        });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(SignalsProperties.class)
    static class PropsConfig {
    }
}
