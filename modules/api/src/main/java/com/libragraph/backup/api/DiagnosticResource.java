package com.libragraph.backup.api;

import com.libragraph.backup.archivers.InteractionArchiverRegistry;
import com.libragraph.backup.archivers.api.InteractionArchiver;
import io.quarkus.arc.ClientProxy;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    InteractionArchiverRegistry registry;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Chat backup is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile
        );
    }

    /** Registered archivers in dispatch order, highest priority first. */
    @GET
    @Path("/archivers")
    public List<Map<String, Object>> archivers() {
        return registry.archivers().stream()
                .map(DiagnosticResource::describe)
                .toList();
    }

    private static Map<String, Object> describe(InteractionArchiver archiver) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", ClientProxy.unwrap(archiver).getClass().getSimpleName());
        entry.put("priority", archiver.priority());
        return entry;
    }
}
