package org.certforge.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum CertificateType {
    RECORD("record-certificate"),
    FIRST_PRIZE("first-prize-certificate");

    private final String baseName;

    public String fileName() {
        return baseName + ".png";
    }
}
