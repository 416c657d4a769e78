package org.xslt.xslCompiler.compiler.errors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.xslt.xslCompiler.compiler.IErrorReporter;
import org.xslt.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Errors and warnings collected while compiling one unit. */
public class CompilerMessages implements IErrorReporter {
    public static class Message {
        public final boolean warning;
        public final boolean continuation;
        public final String errorType;
        public final String message;

        protected Message(boolean warning, boolean continuation, String errorType, String message) {
            this.warning = warning;
            this.continuation = continuation;
            this.errorType = errorType;
            this.message = message;
        }

        Message(BaseCompilerException e) {
            this(false, false, e.getErrorKind(), e.getMessage() != null ? e.getMessage() : "");
        }

        public void format(StringBuilder output) {
            if (!this.continuation) {
                if (this.warning)
                    output.append("warning:");
                else
                    output.append("error:");
                output.append(" ")
                        .append(this.errorType)
                        .append(": ");
            }
            output.append(this.message)
                    .append(System.lineSeparator());
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final List<Message> messages;
    int errorCount = 0;
    int warningCount = 0;

    public CompilerMessages() {
        this.messages = new ArrayList<>();
    }

    void addMessage(Message message) {
        this.messages.add(message);
        if (message.continuation)
            return;
        if (message.warning)
            this.warningCount++;
        else
            this.errorCount++;
    }

    public void reportError(BaseCompilerException exception) {
        this.addMessage(new Message(exception));
    }

    @Override
    public void reportProblem(boolean warning, boolean continuation, String errorType, String message) {
        this.addMessage(new Message(warning, continuation, errorType, message));
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount > 0;
    }

    public int errorCount() {
        return this.errorCount;
    }

    public int warningCount() {
        return this.warningCount;
    }

    public void clear() {
        this.messages.clear();
        this.errorCount = 0;
        this.warningCount = 0;
    }

    public ArrayNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages)
            result.add(message.toJson(mapper));
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages)
            message.format(builder);
        return builder.toString();
    }
}
