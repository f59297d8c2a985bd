package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.docflow.core.state.ExecutionStatus;
import java.io.IOException;
import java.io.Serial;

/// Reads {@link ExecutionStatus} from its lowercase wire value.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class ExecutionStatusDeserializer extends StdDeserializer<ExecutionStatus> {

    @Serial private static final long serialVersionUID = -2365043919920463176L;

    ExecutionStatusDeserializer() {
        super(ExecutionStatus.class);
    }

    @Override
    public ExecutionStatus deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        String value = p.getValueAsString();
        return ExecutionStatus.fromWire(value)
                .orElseThrow(
                        () ->
                                ctxt.weirdStringException(
                                        value, ExecutionStatus.class, "unknown execution status"));
    }
}
