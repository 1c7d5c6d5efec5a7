package io.b2mash.b2b.einvoice.verification;

import java.util.Arrays;
import java.util.Base64;

/** QR image of a verification payload, together with the exact text it encodes. */
public record VerificationImage(String payload, byte[] png) {

  public static final String MEDIA_TYPE = "image/png";

  public VerificationImage {
    png = png.clone();
  }

  @Override
  public byte[] png() {
    return png.clone();
  }

  /** The image as a {@code data:} URI, ready for an {@code <img src>} attribute. */
  public String toDataUri() {
    return "data:" + MEDIA_TYPE + ";base64," + Base64.getEncoder().encodeToString(png);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof VerificationImage image
        && payload.equals(image.payload)
        && Arrays.equals(png, image.png);
  }

  @Override
  public int hashCode() {
    return 31 * payload.hashCode() + Arrays.hashCode(png);
  }

  @Override
  public String toString() {
    return "VerificationImage[payload=" + payload + ", png=" + png.length + " bytes]";
  }
}
