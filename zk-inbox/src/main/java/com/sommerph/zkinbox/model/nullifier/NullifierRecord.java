package com.sommerph.zkinbox.model.nullifier;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NullifierRecord {

    private long epoch;
    private String nullifier;   // decimal field element
    private long registeredAt;  // unix seconds

}
