package io.b2mash.b2b.einvoice.authority;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Issuer settings for the Authority web service.
 *
 * @param taxId issuer tax id (CUIT), digits only
 * @param salesPoint sales point the issuer submits under
 * @param certificatePath PKCS#12 keystore holding the issuer certificate and private key; only
 *     read in {@code live} mode
 * @param certificatePassword keystore password
 * @param endpoint invoicing service URL
 * @param environment testing or production
 * @param mode {@code simulated} (default) or {@code live}
 * @param requestTimeout default timeout for blocking calls to the Authority
 * @param ticketLifetime validity of a signed access ticket
 */
@Validated
@ConfigurationProperties(prefix = "authority")
public record AuthorityProperties(
    @NotBlank String taxId,
    @Positive int salesPoint,
    String certificatePath,
    String certificatePassword,
    @DefaultValue("https://wswhomo.afip.gov.ar/wsfev1/service.asmx") String endpoint,
    @DefaultValue("testing") AuthorityEnvironment environment,
    @DefaultValue("simulated") String mode,
    @NotNull @DefaultValue("30s") Duration requestTimeout,
    @NotNull @DefaultValue("12h") Duration ticketLifetime) {

  public AuthorityCredentials toCredentials() {
    return new AuthorityCredentials(
        taxId, salesPoint, certificatePath, certificatePassword, endpoint, environment);
  }
}
