package org.socionics.ipdb.spring;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import org.socionics.ipdb.PersonalityStore;
import org.socionics.ipdb.StoreState;
import org.socionics.ipdb.backend.BackendKind;

import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersonalityStoreAutoConfiguration")
class PersonalityStoreAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PersonalityStoreAutoConfiguration.class));

    @Test
    @DisplayName("no store without ipdb.data-dir")
    void testInactiveWithoutDataDir() {
        runner.run(context -> assertTrue(context.getBeansOfType(PersonalityStore.class).isEmpty()));
    }

    @Test
    @DisplayName("properties configure an initialized store, closed with the context")
    void testConfiguredStore() {
        PersonalityStore[] holder = new PersonalityStore[1];
        runner.withPropertyValues(
                        "ipdb.data-dir=" + tempDir,
                        "ipdb.backends=FALLBACK",
                        "ipdb.dimensions=16",
                        "ipdb.capacity=500",
                        "ipdb.ef-search=80")
                .run(context -> {
                    PersonalityStore store = context.getBean(PersonalityStore.class);
                    holder[0] = store;
                    assertEquals(StoreState.OPERATIONAL, store.getState());
                    assertEquals(BackendKind.FALLBACK, store.getBackendKind());
                    assertEquals(16, store.getConfig().getDimensions());
                    assertEquals(500, store.getConfig().getCapacity());
                    assertEquals(80, store.getConfig().getEfSearch());
                });
        assertEquals(StoreState.CLOSED, holder[0].getState());
    }

    @Test
    @DisplayName("a user-defined store wins")
    void testBacksOff() {
        runner.withPropertyValues("ipdb.data-dir=" + tempDir)
                .withBean(PersonalityStore.class, () -> PersonalityStore.builder().dataDir(tempDir).build())
                .run(context -> assertEquals(StoreState.UNINITIALIZED,
                        context.getBean(PersonalityStore.class).getState()));
    }
}
