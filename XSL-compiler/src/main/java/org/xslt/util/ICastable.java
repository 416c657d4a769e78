package org.xslt.util;

import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;

/** Checked downcasts, used instead of raw Java casts. */
public interface ICastable {
    /** This object as an instance of the class, or null if it is not one. */
    @Nullable
    default <T> T as(Class<T> clazz) {
        return clazz.isInstance(this) ? clazz.cast(this) : null;
    }

    default <T> T to(Class<T> clazz) {
        return this.to(clazz, "Expected " + clazz.getSimpleName() + ", got " + this);
    }

    default <T> T to(Class<T> clazz, String error) {
        if (!clazz.isInstance(this))
            throw new InternalCompilerError(error);
        return clazz.cast(this);
    }

    default boolean is(Class<?> clazz) {
        return clazz.isInstance(this);
    }
}
