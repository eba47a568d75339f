package com.tournamenttables.config;

import com.tournamenttables.allocation.CostCalculator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AllocationPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(AllocationProperties.class, CostCalculator.class);

    @Test
    void bindsDefaultWeights() {
        contextRunner.run(context -> {
            AllocationProperties properties = context.getBean(AllocationProperties.class);

            assertEquals(500, properties.getAllocation().getMaxTables());
            assertEquals(100_000, properties.getAllocation().getWeights().getTableReuse());
            assertEquals(10_000, properties.getAllocation().getWeights().getTerrainReuse());
            assertEquals(1, properties.getAllocation().getWeights().getTableNumber());
            assertNotNull(context.getBean(CostCalculator.class));
        });
    }

    @Test
    void bindsOverriddenWeights() {
        contextRunner
                .withPropertyValues(
                        "tournament-tables.allocation.max-tables=100",
                        "tournament-tables.allocation.weights.table-reuse=1000000",
                        "tournament-tables.allocation.weights.terrain-reuse=50000",
                        "tournament-tables.allocation.weights.table-number=2"
                )
                .run(context -> {
                    AllocationProperties properties = context.getBean(AllocationProperties.class);

                    assertEquals(100, properties.getAllocation().getMaxTables());
                    assertEquals(1_000_000, properties.getAllocation().getWeights().getTableReuse());
                    assertEquals(50_000, properties.getAllocation().getWeights().getTerrainReuse());
                    assertEquals(2, properties.getAllocation().getWeights().getTableNumber());
                });
    }

    @Test
    void contextFailsWhenTableNumberTierCanOutweighTerrainReuse() {
        contextRunner
                .withPropertyValues(
                        "tournament-tables.allocation.max-tables=500",
                        "tournament-tables.allocation.weights.terrain-reuse=400"
                )
                .run(context -> {
                    assertNotNull(context.getStartupFailure());
                    assertTrue(rootCause(context.getStartupFailure()) instanceof IllegalStateException);
                });
    }

    @Test
    void contextFailsWhenTableReuseIsLessThanTenTimesTerrainReuse() {
        contextRunner
                .withPropertyValues("tournament-tables.allocation.weights.table-reuse=90000")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable cause = throwable;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
