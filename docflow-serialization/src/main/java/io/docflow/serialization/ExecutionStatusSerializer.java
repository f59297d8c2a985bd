package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.docflow.core.state.ExecutionStatus;
import java.io.IOException;
import java.io.Serial;

/// Writes {@link ExecutionStatus} as its lowercase wire value.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class ExecutionStatusSerializer extends StdSerializer<ExecutionStatus> {

    @Serial private static final long serialVersionUID = 4471906338285318874L;

    ExecutionStatusSerializer() {
        super(ExecutionStatus.class);
    }

    @Override
    public void serialize(ExecutionStatus value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(value.wireValue());
    }
}
