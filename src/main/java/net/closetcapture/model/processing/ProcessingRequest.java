package net.closetcapture.model.processing;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Body sent to the remote processing endpoint. One instance is built per logical user action and
 * re-sent unchanged on every automatic retry.
 *
 * @param payload        base64-encoded image bytes, without a data-URI prefix
 * @param ownerId        profile that will own the stored garment
 * @param mimeType       MIME type of the encoded bytes
 * @param idempotencyKey key shared by every attempt of this action
 */
public record ProcessingRequest(
    String payload,
    String ownerId,
    String mimeType,
    String idempotencyKey
) {

    @JsonIgnore
    public int payloadLength() {
        return payload == null ? 0 : payload.length();
    }

    @Override
    public String toString() {
        return "ProcessingRequest{" +
            "payload=" + payloadLength() + " chars" +
            ", ownerId='" + ownerId + '\'' +
            ", mimeType='" + mimeType + '\'' +
            ", idempotencyKey='" + idempotencyKey + '\'' +
            '}';
    }
}
