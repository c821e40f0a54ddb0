package org.decide.authentication.frontendapi.entity;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;

class EnrollmentResponseTest {

    private static final String SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";
    private static final String URI = "otpauth://totp/Decide:voter1?secret=" + SECRET;

    @Test
    void shouldNotShareTheQrImageWithCallers() {
        byte[] image = {1, 2, 3};
        var response = new EnrollmentResponse(SECRET, URI, Optional.of(image));

        image[0] = 9;
        response.qrCode().get()[1] = 9;

        assertThat(response.qrCode().get(), equalTo(new byte[] {1, 2, 3}));
    }

    @Test
    void shouldCompareQrImagesByContent() {
        var first = new EnrollmentResponse(SECRET, URI, Optional.of(new byte[] {1, 2, 3}));
        var second = new EnrollmentResponse(SECRET, URI, Optional.of(new byte[] {1, 2, 3}));
        var other = new EnrollmentResponse(SECRET, URI, Optional.of(new byte[] {1, 2, 4}));

        assertThat(first, equalTo(second));
        assertThat(first.hashCode(), equalTo(second.hashCode()));
        assertThat(first, not(equalTo(other)));
        assertThat(
                new EnrollmentResponse(SECRET, URI, Optional.empty()),
                equalTo(new EnrollmentResponse(SECRET, URI, Optional.empty())));
    }
}
