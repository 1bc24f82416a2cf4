package com.eyelevel.dispatcher.scheduling;

/**
 * Identity of a result: same file, service, version and configuration means the stored result can be reused.
 */
public record ResultKey(String sha256, String serviceName, String version, String configHash) {

    /**
     * Builds the key string used as the result's primary key, e.g. {@code <sha256>.Extract.v4_2.c<hash>}.
     * Dots in the service name and version are replaced so the four parts stay separable. Names that differ
     * only by {@code .} versus {@code _} (service {@code a.b} and {@code a_b}, version {@code 1.2} and
     * {@code 1_2}) map to the same key and share cached results; registered names are expected not to rely
     * on that distinction.
     */
    @Override
    public String toString() {
        return "%s.%s.v%s.c%s".formatted(sha256, serviceName.replace('.', '_'), version.replace('.', '_'),
                                         configHash);
    }
}
