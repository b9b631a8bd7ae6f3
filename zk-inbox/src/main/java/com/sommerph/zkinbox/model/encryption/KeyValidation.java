package com.sommerph.zkinbox.model.encryption;

import lombok.Value;

@Value
public class KeyValidation {

    boolean valid;
    String error;

    public static KeyValidation ok() {
        return new KeyValidation(true, null);
    }

    public static KeyValidation invalid(String error) {
        return new KeyValidation(false, error);
    }

}
