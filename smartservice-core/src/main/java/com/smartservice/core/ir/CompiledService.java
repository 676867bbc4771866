package com.smartservice.core.ir;

import com.smartservice.core.model.ServiceMeta;
import com.smartservice.core.version.VersionCompatibility;

import java.util.Objects;

/**
 * Service preamble with the outcome of the version gate.
 *
 * @param meta declared service metadata
 * @param compatibility how the declared version relates to the compiler version
 */
public record CompiledService(ServiceMeta meta, VersionCompatibility compatibility) {

    public CompiledService {
        Objects.requireNonNull(meta, "meta must not be null");
        Objects.requireNonNull(compatibility, "compatibility must not be null");
        if (!compatibility.isCompatible()) {
            throw new IllegalArgumentException("Incompatible service version " + meta.version());
        }
    }
}
