package io.github.cyfko.cohortql.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.cohortql.core.CohortQueryPipeline;
import io.github.cyfko.cohortql.core.catalog.CatalogIndex;
import io.github.cyfko.cohortql.core.catalog.CatalogLoader;
import io.github.cyfko.cohortql.core.catalog.FieldValidator;
import io.github.cyfko.cohortql.core.catalog.JsonCatalogLoader;
import io.github.cyfko.cohortql.core.codec.FilterCodec;
import io.github.cyfko.cohortql.core.codec.WireFilterMapper;
import io.github.cyfko.cohortql.core.compose.FilterComposer;
import io.github.cyfko.cohortql.core.query.QueryBuilder;
import io.github.cyfko.cohortql.core.resolve.ConflictResolver;
import io.github.cyfko.cohortql.core.search.CachingCatalogSearch;
import io.github.cyfko.cohortql.core.search.CatalogSearch;
import io.github.cyfko.cohortql.core.spi.GraphQLExecutionClient;
import io.github.cyfko.cohortql.core.spi.TermExtractor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Registers the CohortQL services as beans.
 * <p>
 * The stateless services (resolver, composer, codec, query builder) are always available. The
 * catalog beans and the {@link CohortQueryPipeline} need a {@link CatalogLoader}: either the JSON
 * loader created from {@code cohortql.catalog-path} or one supplied by the application. Every bean
 * backs off when the application defines its own.
 * </p>
 *
 * @since 1.0.0
 */
@AutoConfiguration
@ConditionalOnClass(CohortQueryPipeline.class)
@EnableConfigurationProperties(CohortQlProperties.class)
public class CohortQlAutoConfiguration {

    private static final Logger log = Logger.getLogger(CohortQlAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public WireFilterMapper wireFilterMapper(ObjectProvider<ObjectMapper> objectMapper) {
        return new WireFilterMapper(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterCodec filterCodec() {
        return new FilterCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConflictResolver conflictResolver(CohortQlProperties properties) {
        return new ConflictResolver(properties.getResolution().toPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterComposer filterComposer() {
        return new FilterComposer();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBuilder queryBuilder(CohortQlProperties properties, WireFilterMapper wireFilterMapper) {
        return new QueryBuilder(properties.getQuery().toPolicy(), wireFilterMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cohortql", name = "catalog-path")
    public CatalogLoader catalogLoader(CohortQlProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonCatalogLoader(Path.of(properties.getCatalogPath()), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CatalogLoader.class)
    public CatalogIndex catalogIndex(CatalogLoader catalogLoader, CohortQlProperties properties) {
        CatalogIndex index = new CatalogIndex(catalogLoader, properties.getSearch().toPolicy());
        if (properties.isEagerLoad()) {
            index.buildIndex(false);
            log.info(() -> "CohortQL catalog index ready with " + index.getEntryCount() + " fields");
        }
        return index;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CatalogIndex.class)
    public FieldValidator fieldValidator(CatalogIndex catalogIndex) {
        return new FieldValidator(catalogIndex);
    }

    /**
     * Preferred over the bare {@link CatalogIndex} wherever a {@link CatalogSearch} is injected.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "catalogSearch")
    @ConditionalOnBean(CatalogIndex.class)
    public CachingCatalogSearch catalogSearch(CatalogIndex catalogIndex, CohortQlProperties properties) {
        return new CachingCatalogSearch(catalogIndex, properties.getCache().toPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CatalogSearch.class)
    public CohortQueryPipeline cohortQueryPipeline(CatalogSearch catalogSearch,
                                                   ConflictResolver conflictResolver,
                                                   FilterComposer filterComposer,
                                                   QueryBuilder queryBuilder,
                                                   ObjectProvider<TermExtractor> termExtractor,
                                                   ObjectProvider<GraphQLExecutionClient> executionClient) {
        return CohortQueryPipeline.builder(catalogSearch)
                .resolver(conflictResolver)
                .composer(filterComposer)
                .queryBuilder(queryBuilder)
                .termExtractor(termExtractor.getIfAvailable())
                .executionClient(executionClient.getIfAvailable())
                .build();
    }
}
