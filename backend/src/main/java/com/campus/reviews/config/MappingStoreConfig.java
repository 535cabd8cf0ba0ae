package com.campus.reviews.config;

import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.orm.jpa.EntityManagerFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.orm.jpa.LocalContainerEntityManagerFactoryBean;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Author mapping store. Connects with the elevated service account only; the
 * ordinary application role has no grant on this table (see db/author-mapping-policy.sql).
 * Writes here are never part of a content-store transaction.
 */
@Configuration
@EnableJpaRepositories(
        basePackages = "com.campus.reviews.mapping",
        entityManagerFactoryRef = "mappingEntityManagerFactory",
        transactionManagerRef = "mappingTransactionManager"
)
public class MappingStoreConfig {

    @Bean
    @ConfigurationProperties("app.datasource.mapping")
    public DataSourceProperties mappingDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    public DataSource mappingDataSource(@Qualifier("mappingDataSourceProperties") DataSourceProperties props) {
        return props.initializeDataSourceBuilder().build();
    }

    @Bean(name = "mappingEntityManagerFactory")
    public LocalContainerEntityManagerFactoryBean mappingEntityManagerFactory(
            EntityManagerFactoryBuilder builder,
            @Qualifier("mappingDataSource") DataSource dataSource
    ) {
        return builder
                .dataSource(dataSource)
                .packages("com.campus.reviews.mapping")
                .persistenceUnit("mapping")
                .build();
    }

    @Bean(name = "mappingTransactionManager")
    public PlatformTransactionManager mappingTransactionManager(
            @Qualifier("mappingEntityManagerFactory") EntityManagerFactory emf
    ) {
        return new JpaTransactionManager(emf);
    }
}
