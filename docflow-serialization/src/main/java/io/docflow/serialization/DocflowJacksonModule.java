package io.docflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.ExecutionStatus;
import java.io.Serial;

/// Jackson `SimpleModule` registering the docflow type handlers in one place.
///
/// - `ExecutionSnapshot`: {@link ExecutionSnapshotSerializer} /
///   {@link ExecutionSnapshotDeserializer}, snake_case persisted form
/// - `ExecutionStatus`: lowercase wire values
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see ExecutionStateSerializer for the convenience factory API
public class DocflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3318800513126934417L;

    public DocflowJacksonModule() {
        super("DocflowJacksonModule");

        addSerializer(ExecutionSnapshot.class, new ExecutionSnapshotSerializer());
        addDeserializer(ExecutionSnapshot.class, new ExecutionSnapshotDeserializer());

        addSerializer(ExecutionStatus.class, new ExecutionStatusSerializer());
        addDeserializer(ExecutionStatus.class, new ExecutionStatusDeserializer());
    }
}
