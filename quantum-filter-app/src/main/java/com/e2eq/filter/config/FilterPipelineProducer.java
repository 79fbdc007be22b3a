package com.e2eq.filter.config;

import com.e2eq.filter.model.persistent.morphia.compiler.mongo.MongoFilterCompiler;
import com.e2eq.filter.model.persistent.morphia.query.FilterJsonReader;
import com.e2eq.filter.model.persistent.morphia.query.FilterPipeline;
import com.e2eq.filter.model.security.FilterSecurityPolicy;
import com.mongodb.client.MongoClient;
import dev.morphia.Datastore;
import dev.morphia.Morphia;
import dev.morphia.config.MorphiaConfig;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

@ApplicationScoped
public class FilterPipelineProducer {

    @Produces
    @Singleton
    public FilterSecurityPolicy filterSecurityPolicy(FilterSecurityConfig config) {
        FilterSecurityPolicy.Builder builder = FilterSecurityPolicy.defaults().toBuilder()
                .maxDepth(config.maxDepth())
                .maxArrayLength(config.maxArrayLength())
                .maxStringLength(config.maxStringLength())
                .maxObjectKeys(config.maxObjectKeys());
        config.protectedFields().ifPresent(builder::protectedFields);
        FilterSecurityPolicy policy = builder.build();
        Log.infof("Advanced filter policy: depth=%d arrays=%d strings=%d keys=%d protected=%s",
                policy.maxDepth(), policy.maxArrayLength(), policy.maxStringLength(), policy.maxObjectKeys(),
                policy.protectedFields());
        return policy;
    }

    @Produces
    @Singleton
    public MongoFilterCompiler mongoFilterCompiler(FilterSecurityConfig config) {
        return MongoFilterCompiler.builder()
                .noObjectIdCastFields(config.noObjectIdCastFields().orElse(null))
                .identifierSuffix(config.identifierSuffix())
                .maxRecursionDepth(config.maxRecursionDepth())
                .build();
    }

    @Produces
    @Singleton
    public FilterPipeline filterPipeline(FilterSecurityConfig config, FilterSecurityPolicy policy, MongoFilterCompiler compiler) {
        return FilterPipeline.builder()
                .reader(new FilterJsonReader(config.jsonMaxNestingDepth()))
                .compiler(compiler)
                .policy(policy)
                .rejectOnFatalViolation(config.rejectOnFatalViolation())
                .rejectOnViolation(config.rejectOnViolation())
                .build();
    }

    @Produces
    @Singleton
    public Datastore morphiaDatastore(MongoClient mongoClient, FilterSecurityConfig config) {
        Log.infof("Creating Morphia datastore for database: %s", config.database());
        return Morphia.createDatastore(mongoClient, MorphiaConfig.load().database(config.database()));
    }
}
