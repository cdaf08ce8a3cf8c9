package org.socionics.ipdb.spring;

import java.nio.file.Path;

import org.socionics.ipdb.PersonalityStore;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for {@link PersonalityStore}.
 *
 * <p>Activated when {@code ipdb.data-dir} is set. The store is initialized
 * when the bean is created and closed with the context.
 */
@AutoConfiguration
@ConditionalOnClass(PersonalityStore.class)
@EnableConfigurationProperties(PersonalityStoreProperties.class)
public class PersonalityStoreAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(PersonalityStore.class)
    @ConditionalOnProperty(prefix = "ipdb", name = "data-dir")
    public PersonalityStore personalityStore(PersonalityStoreProperties props) {
        PersonalityStore.Builder builder = PersonalityStore.builder()
            .dataDir(Path.of(props.getDataDir()));

        if (props.getBackends() != null) {
            builder.backends(props.getBackends());
        }
        if (props.getDimensions() != null && props.getDimensions() > 0) {
            builder.dimensions(props.getDimensions());
        }
        if (props.getCapacity() != null) {
            builder.capacity(props.getCapacity());
        }
        if (props.getM() != null) {
            builder.m(props.getM());
        }
        if (props.getEfConstruction() != null) {
            builder.efConstruction(props.getEfConstruction());
        }
        if (props.getEfSearch() != null) {
            builder.efSearch(props.getEfSearch());
        }
        if (props.getExactSearchThreshold() != null) {
            builder.exactSearchThreshold(props.getExactSearchThreshold());
        }

        PersonalityStore store = builder.build();
        store.initialize();
        return store;
    }
}
