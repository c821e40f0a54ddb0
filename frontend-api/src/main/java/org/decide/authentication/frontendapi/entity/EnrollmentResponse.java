package org.decide.authentication.frontendapi.entity;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * The new secret, its provisioning URI and a QR image of the URI when a renderer is present. The
 * image bytes are copied on the way in and on the way out.
 */
public record EnrollmentResponse(String secret, String provisioningUri, Optional<byte[]> qrCode) {

    public EnrollmentResponse {
        qrCode = qrCode.map(byte[]::clone);
    }

    @Override
    public Optional<byte[]> qrCode() {
        return qrCode.map(byte[]::clone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnrollmentResponse)) return false;
        EnrollmentResponse that = (EnrollmentResponse) o;
        return Objects.equals(secret, that.secret)
                && Objects.equals(provisioningUri, that.provisioningUri)
                && Arrays.equals(qrCode.orElse(null), that.qrCode.orElse(null));
    }

    @Override
    public int hashCode() {
        return Objects.hash(secret, provisioningUri, Arrays.hashCode(qrCode.orElse(null)));
    }
}
