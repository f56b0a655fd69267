package uow.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.annotation.Isolation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnitOfWorkPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(UnitOfWorkProperties.class);
            assertEquals(Isolation.DEFAULT, props.getTransaction().getIsolation());
            assertEquals(-1, props.getTransaction().getTimeoutSeconds());
            assertFalse(props.getTransaction().isReadOnly());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("uow", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "uow.transaction.isolation=READ_COMMITTED",
                "uow.transaction.timeout-seconds=15",
                "uow.transaction.read-only=true",
                "uow.metrics.enabled=false",
                "uow.metrics.name-prefix=billing.uow"
        ).run(ctx -> {
            var props = ctx.getBean(UnitOfWorkProperties.class);
            assertEquals(Isolation.READ_COMMITTED, props.getTransaction().getIsolation());
            assertEquals(15, props.getTransaction().getTimeoutSeconds());
            assertTrue(props.getTransaction().isReadOnly());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("billing.uow", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(UnitOfWorkProperties.class)
    static class PropsConfig {
    }
}
