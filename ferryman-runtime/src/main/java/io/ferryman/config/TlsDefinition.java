/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import java.nio.file.Path;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Server certificate for a TLS listener, PEM encoded.
 *
 * @param certificateFile certificate chain
 * @param keyFile PKCS#8 private key
 * @param keyPassword key password, or null if the key is not encrypted
 */
public record TlsDefinition(Path certificateFile, Path keyFile, @Nullable String keyPassword) {

    public TlsDefinition {
        Objects.requireNonNull(certificateFile, "certificateFile");
        Objects.requireNonNull(keyFile, "keyFile");
    }
}
