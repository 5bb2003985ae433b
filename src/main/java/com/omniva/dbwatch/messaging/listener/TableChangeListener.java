package com.omniva.dbwatch.messaging.listener;

import com.omniva.dbwatch.messaging.model.ChangeType;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to automatically register table listeners
 * Combines @Component with table configuration mapping
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface TableChangeListener {

    /**
     * Table this listener handles: {@code name}, {@code schema.name} or
     * {@code [schema].[name]} (case-insensitive, schema defaults to dbo)
     */
    String table();

    /**
     * Supported change types (default: all)
     */
    ChangeType[] events() default {ChangeType.INSERT, ChangeType.UPDATE, ChangeType.DELETE};

    /**
     * Whether this listener is enabled by default
     */
    boolean enabled() default true;
}
