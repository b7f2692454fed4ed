package tech.syncbridge.platform.mapping;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import tech.syncbridge.transform.TransformationEngine;
import tech.syncbridge.transform.function.FunctionRegistry;
import tech.syncbridge.transform.mapping.MappingValidator;

/**
 * Exposes the transformation library as CDI beans sharing one function registry.
 */
@ApplicationScoped
public class TransformProducer {

    @Produces
    @Singleton
    FunctionRegistry functionRegistry() {
        return FunctionRegistry.builtins();
    }

    @Produces
    @Singleton
    TransformationEngine transformationEngine(FunctionRegistry functions) {
        return new TransformationEngine(functions);
    }

    @Produces
    @Singleton
    MappingValidator mappingValidator(FunctionRegistry functions) {
        return new MappingValidator(functions);
    }
}
