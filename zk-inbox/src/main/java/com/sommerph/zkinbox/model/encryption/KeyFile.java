package com.sommerph.zkinbox.model.encryption;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exported recipient key pair. A protected file carries {@code encrypted}, {@code salt}
 * and {@code iv} (all Base64); an unprotected one carries the two keys in clear.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KeyFile {

    public static final String CURRENT_VERSION = "1.0";

    private String publicKey;
    private String privateKey;
    private String encrypted;
    private String salt;
    private String iv;
    private String version;

    @JsonProperty("protected")
    private boolean passwordProtected;

}
