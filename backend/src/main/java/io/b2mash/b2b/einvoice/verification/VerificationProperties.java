package io.b2mash.b2b.einvoice.verification;

import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * QR rendering settings.
 *
 * @param size width and height of the image in pixels
 * @param margin quiet zone in modules
 * @param errorCorrection QR error correction level (L, M, Q, H)
 */
@Validated
@ConfigurationProperties(prefix = "verification")
public record VerificationProperties(
    @Min(21) @DefaultValue("300") int size,
    @Min(0) @DefaultValue("2") int margin,
    @NotNull @DefaultValue("M") ErrorCorrectionLevel errorCorrection) {}
