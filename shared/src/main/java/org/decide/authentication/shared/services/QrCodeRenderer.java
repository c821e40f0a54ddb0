package org.decide.authentication.shared.services;

/** Turns an {@code otpauth://} provisioning URI into image bytes an authenticator app can scan. */
public interface QrCodeRenderer {

    byte[] render(String provisioningUri);
}
