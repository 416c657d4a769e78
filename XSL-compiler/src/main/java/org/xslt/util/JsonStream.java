package org.xslt.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.xslt.xslCompiler.compiler.errors.InternalCompilerError;

import java.util.ArrayDeque;
import java.util.Deque;

/** Writes a JSON document incrementally on an {@link IIndentStream}.
 * Every array element and object property goes on its own line.
 * Misuse, such as a value without a label inside an object, is an
 * {@link InternalCompilerError}. */
public class JsonStream {
    /** An open array or object. */
    static final class Scope {
        final boolean isObject;
        int elements;
        boolean labelWritten;

        Scope(boolean isObject) {
            this.isObject = isObject;
        }
    }

    private final Deque<Scope> scopes;
    private final IIndentStream stream;
    private final ObjectMapper mapper;

    public JsonStream(IIndentStream stream) {
        this.stream = stream;
        this.scopes = new ArrayDeque<>();
        this.mapper = Utilities.deterministicObjectMapper();
    }

    String quote(String string) {
        try {
            return this.mapper.writeValueAsString(string);
        } catch (JsonProcessingException ex) {
            throw new InternalCompilerError("Cannot encode string " + Utilities.singleQuote(string));
        }
    }

    /** Separator before an element, or the line break after an opening bracket. */
    void separate(Scope scope) {
        if (scope.elements == 0)
            this.stream.increase();
        else
            this.stream.append(",").newline();
        scope.elements++;
    }

    /** Called before writing any value. */
    void beforeValue() {
        Scope scope = this.scopes.peek();
        if (scope == null)
            return;
        if (scope.isObject) {
            Utilities.enforce(scope.labelWritten, "Value in an object must follow a label");
            scope.labelWritten = false;
        } else {
            this.separate(scope);
        }
    }

    public JsonStream label(String label) {
        Scope scope = this.scopes.peek();
        if (scope == null || !scope.isObject)
            throw new InternalCompilerError("Label " + Utilities.singleQuote(label) + " outside of an object");
        Utilities.enforce(!scope.labelWritten, "Two consecutive labels");
        this.separate(scope);
        this.stream.append(this.quote(label)).append(": ");
        scope.labelWritten = true;
        return this;
    }

    public JsonStream append(String string) {
        this.beforeValue();
        this.stream.append(this.quote(string));
        return this;
    }

    public JsonStream append(long value) {
        this.beforeValue();
        this.stream.append(value);
        return this;
    }

    public JsonStream append(boolean value) {
        this.beforeValue();
        this.stream.append(value);
        return this;
    }

    @SuppressWarnings("UnusedReturnValue")
    public JsonStream appendNull() {
        this.beforeValue();
        this.stream.append("null");
        return this;
    }

    JsonStream open(boolean isObject) {
        this.beforeValue();
        this.scopes.push(new Scope(isObject));
        this.stream.append(isObject ? "{" : "[");
        return this;
    }

    JsonStream close(boolean isObject) {
        Scope scope = this.scopes.poll();
        if (scope == null || scope.isObject != isObject)
            throw new InternalCompilerError("Mismatched " + (isObject ? "object" : "array") + " end");
        Utilities.enforce(!scope.labelWritten, "Label without a value");
        if (scope.elements != 0)
            this.stream.decrease().newline();
        this.stream.append(isObject ? "}" : "]");
        return this;
    }

    public JsonStream beginArray() {
        return this.open(false);
    }

    public JsonStream endArray() {
        return this.close(false);
    }

    public JsonStream beginObject() {
        return this.open(true);
    }

    public JsonStream endObject() {
        return this.close(true);
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
