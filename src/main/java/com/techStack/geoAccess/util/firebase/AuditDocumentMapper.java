package com.techStack.geoAccess.util.firebase;

import com.techStack.geoAccess.models.audit.AuditEntry;
import com.techStack.geoAccess.models.audit.ChangeType;
import com.techStack.geoAccess.models.audit.NotificationReceipt;
import com.techStack.geoAccess.models.audit.TamperNote;

import java.util.HashMap;
import java.util.Map;

import static com.techStack.geoAccess.util.firebase.FirestoreFields.*;

public final class AuditDocumentMapper {

    private AuditDocumentMapper() {}

    public static Map<String, Object> toMap(AuditEntry entry) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", entry.getId());
        putTimestamp(data, "timestamp", entry.getTimestamp());
        data.put("actor", entry.getActor());
        data.put("changeType", enumName(entry.getChangeType()));
        data.put("oldValue", entry.getOldValue());
        data.put("newValue", entry.getNewValue());
        data.put("justification", entry.getJustification());
        data.put("requestIp", entry.getRequestIp());
        data.put("userAgent", entry.getUserAgent());
        data.put("checksum", entry.getChecksum());
        return data;
    }

    /**
     * Unknown change types are kept as null rather than dropped so the entry still fails
     * verification instead of disappearing.
     */
    public static AuditEntry fromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return AuditEntry.builder()
                .id(getString(data, "id"))
                .timestamp(getInstant(data, "timestamp"))
                .actor(getString(data, "actor"))
                .changeType(getEnum(data, "changeType", ChangeType.class))
                .oldValue(getString(data, "oldValue"))
                .newValue(getString(data, "newValue"))
                .justification(getString(data, "justification"))
                .requestIp(getString(data, "requestIp"))
                .userAgent(getString(data, "userAgent"))
                .checksum(getString(data, "checksum"))
                .build();
    }

    public static Map<String, Object> toMap(NotificationReceipt receipt) {
        Map<String, Object> data = new HashMap<>();
        data.put("entryId", receipt.getEntryId());
        data.put("delivered", receipt.isDelivered());
        data.put("recipientCount", receipt.getRecipientCount());
        data.put("error", receipt.getError());
        putTimestamp(data, "recordedAt", receipt.getRecordedAt());
        return data;
    }

    public static NotificationReceipt receiptFromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        return NotificationReceipt.builder()
                .entryId(getString(data, "entryId"))
                .delivered(getBoolean(data, "delivered"))
                .recipientCount((int) getLong(data, "recipientCount"))
                .error(getString(data, "error"))
                .recordedAt(getInstant(data, "recordedAt"))
                .build();
    }

    public static Map<String, Object> toMap(TamperNote note) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", note.getId());
        data.put("entryId", note.getEntryId());
        putTimestamp(data, "detectedAt", note.getDetectedAt());
        data.put("detectedBy", note.getDetectedBy());
        data.put("detail", note.getDetail());
        return data;
    }
}
