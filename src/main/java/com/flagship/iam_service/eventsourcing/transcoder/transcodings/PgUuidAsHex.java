package com.flagship.iam_service.eventsourcing.transcoder.transcodings;

import com.flagship.iam_service.eventsourcing.transcoder.Transcoding;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.util.UUID;

/**
 * uuid values handed out by the PostgreSQL driver as untyped PGobject.
 * Written in the same hex form as a plain UUID.
 */
public class PgUuidAsHex implements Transcoding<PGobject> {

    private static final String UUID_TYPE = "uuid";

    @Override
    public Class<PGobject> type() {
        return PGobject.class;
    }

    @Override
    public String name() {
        return "pguuid_hex";
    }

    @Override
    public Object encode(PGobject value) {
        if (!UUID_TYPE.equals(value.getType()) || value.getValue() == null) {
            throw new IllegalArgumentException("Not a PostgreSQL uuid: " + value.getType());
        }
        return UuidAsHex.toHex(UUID.fromString(value.getValue()));
    }

    @Override
    public PGobject decode(Object data) {
        PGobject object = new PGobject();
        object.setType(UUID_TYPE);
        try {
            object.setValue(UuidAsHex.fromHex((String) data).toString());
        } catch (SQLException e) {
            throw new IllegalArgumentException("Invalid PostgreSQL uuid: " + data, e);
        }
        return object;
    }
}
