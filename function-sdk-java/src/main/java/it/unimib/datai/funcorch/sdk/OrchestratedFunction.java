package it.unimib.datai.funcorch.sdk;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * Marks a class as an in-process function handler.
 * This is a meta-annotation that combines {@link Component} for Spring discovery; the bean name
 * is the entry point that function locations refer to.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface OrchestratedFunction {
    /** Entry point name. Defaults to the decapitalized class name. */
    @AliasFor(annotation = Component.class)
    String value() default "";
}
