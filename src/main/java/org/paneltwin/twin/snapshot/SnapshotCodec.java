package org.paneltwin.twin.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.paneltwin.twin.DigitalTwinException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * JSON reader/writer for {@link TwinSnapshot}.
 */
public final class SnapshotCodec {
    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String toJson(TwinSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_SNAPSHOT,
                    "cannot serialize snapshot: " + ex.getOriginalMessage(),
                    ex
            );
        }
    }

    public void write(TwinSnapshot snapshot, OutputStream out) {
        Objects.requireNonNull(snapshot, "snapshot");
        try {
            mapper.writeValue(out, snapshot);
        } catch (IOException ex) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_SNAPSHOT,
                    "cannot write snapshot: " + ex.getMessage(),
                    ex
            );
        }
    }

    /**
     * @throws DigitalTwinException with {@link DigitalTwinException#REASON_INVALID_SNAPSHOT}
     * when the text is not a well-formed snapshot.
     */
    public TwinSnapshot fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new DigitalTwinException(DigitalTwinException.REASON_INVALID_SNAPSHOT, "snapshot text is empty");
        }
        try {
            return mapper.readValue(json, TwinSnapshot.class);
        } catch (JsonProcessingException ex) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_SNAPSHOT,
                    "malformed snapshot: " + ex.getOriginalMessage(),
                    ex
            );
        }
    }

    public TwinSnapshot read(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            return mapper.readValue(in, TwinSnapshot.class);
        } catch (IOException ex) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_SNAPSHOT,
                    "cannot read snapshot: " + ex.getMessage(),
                    ex
            );
        }
    }
}
