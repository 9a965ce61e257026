package com.camfleet.console.profile;

import com.camfleet.console.command.Command;
import com.camfleet.console.command.CommandOrchestrator;
import com.camfleet.console.command.CommandType;
import com.camfleet.console.store.JsonFileStore;
import com.camfleet.console.store.ProfilesDocument;
import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.msg.GroupOperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Named settings bundles, persisted in {@code profiles.json}.
 * <p>
 * Applying a profile is an ordinary {@link CommandType#APPLY_PROFILE} group command, so it reports
 * results exactly like any other group operation.
 * </p>
 */
public class ProfileService {
    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final JsonFileStore<ProfilesDocument> store;
    private final CommandOrchestrator orchestrator;

    // sorted by name; guarded by this
    private final Map<String, Profile> profiles = new TreeMap<>();

    public ProfileService(JsonFileStore<ProfilesDocument> store, CommandOrchestrator orchestrator) {
        this.store = store;
        this.orchestrator = orchestrator;
    }

    public synchronized void load() {
        ProfilesDocument document = store.load();
        if (document.getProfiles() != null) {
            for (Profile profile : document.getProfiles()) {
                if (profile.getName() != null && profile.getSettings() != null) {
                    profiles.put(profile.getName(), profile);
                }
            }
        }
        log.info("Loaded {} profiles", profiles.size());
    }

    /**
     * Creates or replaces the profile with this name.
     */
    public synchronized Profile save(String name, ProfileSettings settings) {
        if (name == null || name.isBlank()) {
            throw ApiException.invalidRequest("profile name must not be blank");
        }
        if (settings == null || settings.isEmpty()) {
            throw ApiException.invalidRequest("profile needs camera or video settings");
        }
        Profile profile = new Profile(name, settings);
        boolean replaced = profiles.put(name, profile) != null;
        persist();
        log.info("{} profile '{}'", replaced ? "Updated" : "Saved", name);
        return profile;
    }

    /**
     * Removes the profile; does nothing when it does not exist.
     */
    public synchronized void delete(String name) {
        if (profiles.remove(name) != null) {
            persist();
            log.info("Deleted profile '{}'", name);
        }
    }

    public synchronized List<Profile> list() {
        return new ArrayList<>(profiles.values());
    }

    public Mono<List<GroupOperationResult>> apply(String name, Collection<String> deviceIds) {
        return Mono.defer(() -> {
            Profile profile;
            synchronized (this) {
                profile = profiles.get(name);
            }
            if (profile == null) {
                return Mono.error(new ApiException(ErrorCode.NOT_FOUND, "Profile not found: " + name));
            }
            log.info("Applying profile '{}' to {} devices", name, deviceIds.size());
            return orchestrator.executeGroup(Command.of(CommandType.APPLY_PROFILE, deviceIds, profile.getSettings()));
        });
    }

    private void persist() {
        try {
            store.save(new ProfilesDocument(new ArrayList<>(profiles.values())));
        } catch (UncheckedIOException e) {
            log.error("Failed to persist profiles to {}", store.getFile(), e);
        }
    }
}
