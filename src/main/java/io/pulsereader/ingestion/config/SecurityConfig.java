package io.pulsereader.ingestion.config;

public record SecurityConfig(String serviceToken) {

    public boolean hasServiceToken() {
        return serviceToken != null && !serviceToken.isBlank();
    }

    @Override
    public String toString() {
        return "SecurityConfig[serviceToken=" + (hasServiceToken() ? "<set>" : "<none>") + "]";
    }
}
