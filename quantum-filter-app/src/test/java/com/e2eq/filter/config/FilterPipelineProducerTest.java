package com.e2eq.filter.config;

import com.e2eq.filter.exceptions.FilterRejectedException;
import com.e2eq.filter.model.persistent.morphia.compiler.mongo.MongoFilterCompiler;
import com.e2eq.filter.model.persistent.morphia.query.CompiledFilter;
import com.e2eq.filter.model.persistent.morphia.query.FilterPipeline;
import com.e2eq.filter.model.security.FilterSecurityPolicy;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FilterPipelineProducerTest {

    static class TestConfig implements FilterSecurityConfig {
        int maxDepth = 5;
        Set<String> protectedFields;
        Set<String> noCast;
        boolean rejectOnFatal = true;
        boolean rejectOnViolation = false;

        @Override public int maxDepth() { return maxDepth; }
        @Override public int maxArrayLength() { return 100; }
        @Override public int maxStringLength() { return 200; }
        @Override public int maxObjectKeys() { return 50; }
        @Override public Optional<Set<String>> protectedFields() { return Optional.ofNullable(protectedFields); }
        @Override public Optional<Set<String>> noObjectIdCastFields() { return Optional.ofNullable(noCast); }
        @Override public String identifierSuffix() { return "_id"; }
        @Override public int maxRecursionDepth() { return 10; }
        @Override public int jsonMaxNestingDepth() { return 64; }
        @Override public boolean rejectOnFatalViolation() { return rejectOnFatal; }
        @Override public boolean rejectOnViolation() { return rejectOnViolation; }
        @Override public String database() { return "test"; }
    }

    private final FilterPipelineProducer producer = new FilterPipelineProducer();

    private FilterPipeline pipeline(TestConfig config) {
        FilterSecurityPolicy policy = producer.filterSecurityPolicy(config);
        MongoFilterCompiler compiler = producer.mongoFilterCompiler(config);
        return producer.filterPipeline(config, policy, compiler);
    }

    @Test
    public void policy_defaultsKeepBuiltInProtectedFields() {
        FilterSecurityPolicy policy = producer.filterSecurityPolicy(new TestConfig());
        assertTrue(policy.isProtected("isDeleted"));
        assertEquals(5, policy.maxDepth());
    }

    @Test
    public void policy_configuredProtectedFieldsReplaceDefaults() {
        TestConfig config = new TestConfig();
        config.protectedFields = Set.of("tenantId");
        config.maxDepth = 2;
        FilterSecurityPolicy policy = producer.filterSecurityPolicy(config);

        assertTrue(policy.isProtected("tenantId"));
        assertFalse(policy.isProtected("__v"));
        assertEquals(2, policy.maxDepth());
    }

    @Test
    public void compiler_honoursNoCastFields() {
        TestConfig config = new TestConfig();
        config.noCast = Set.of("external_id");
        MongoFilterCompiler compiler = producer.mongoFilterCompiler(config);

        assertFalse(compiler.castsToObjectId("external_id"));
        assertTrue(compiler.castsToObjectId("user_id"));
    }

    @Test
    public void pipeline_rejectionSwitchesFollowConfig() {
        TestConfig config = new TestConfig();
        config.rejectOnViolation = true;
        assertThrows(FilterRejectedException.class, () -> pipeline(config).process("{\"__v\":1}"));

        TestConfig lenient = new TestConfig();
        lenient.rejectOnFatal = false;
        lenient.maxDepth = 0;
        CompiledFilter compiled = pipeline(lenient).process("{\"or\":[{\"a\":1}]}");
        assertTrue(compiled.failedClosed());
    }
}
