package ai.codenav.analyzer;

import ai.codenav.util.QueryLimits;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps (capability interface, language tag) to providers.
 *
 * <p>Providers are kept per capability in registration order. Lookups are lock-free; registration is expected to
 * happen up front, before queries start.
 */
public final class CapabilityRegistry {
    private static final Logger logger = LogManager.getLogger(CapabilityRegistry.class);

    private record Registration(CapabilityProvider provider, boolean available) {}

    private final Map<Class<? extends CapabilityProvider>, List<Registration>> registrations =
            new ConcurrentHashMap<>();
    private final QueryLimits limits;

    public CapabilityRegistry() {
        this(QueryLimits.defaults());
    }

    public CapabilityRegistry(QueryLimits limits) {
        this.limits = limits;
    }

    public QueryLimits limits() {
        return limits;
    }

    /**
     * Registers a provider for a capability. Its availability is probed once, here; a probe that throws counts as
     * unavailable.
     */
    public <T extends CapabilityProvider> void registerProvider(Class<T> capability, T provider) {
        boolean available;
        try {
            available = provider.isAvailable();
        } catch (RuntimeException e) {
            logger.warn(
                    "Availability probe failed for {} provider {}: {}",
                    capability.getSimpleName(),
                    provider.language(),
                    e.getMessage());
            available = false;
        }
        registrations
                .computeIfAbsent(capability, k -> new CopyOnWriteArrayList<>())
                .add(new Registration(provider, available));
        logger.debug(
                "Registered {} for {} ({})",
                capability.getSimpleName(),
                provider.language(),
                available ? "available" : "unavailable");
    }

    /** Registers a provider under every capability it offers. */
    public void registerAll(LanguageProvider provider) {
        registerProvider(TypeHierarchyProvider.class, provider);
        registerProvider(CallHierarchyProvider.class, provider);
        registerProvider(SuperMethodsProvider.class, provider);
        registerProvider(SymbolSearchProvider.class, provider);
        registerProvider(ImplementationsProvider.class, provider);
        registerProvider(UsagesProvider.class, provider);
        registerProvider(DefinitionProvider.class, provider);
    }

    /**
     * Runs a family's probe and, when it passes, lets the family register its providers. Any exception is logged and
     * swallowed so that the remaining families can still register.
     *
     * @return true if the family registered
     */
    public boolean registerFamily(LanguageFamily family, CodeModel model) {
        try {
            if (!family.isSupported(model)) {
                logger.info("Skipping language family {}: not present in the code model", family.name());
                return false;
            }
            family.register(this, model, limits);
            logger.info("Registered language family {}", family.name());
            return true;
        } catch (RuntimeException | LinkageError e) {
            logger.warn("Failed to register language family {}", family.name(), e);
            return false;
        }
    }

    /**
     * Picks the provider for an element: providers tagged with the element's language first, then those tagged with
     * its base language, then any other. Within each tier registration order decides; the first available provider
     * whose {@link CapabilityProvider#canHandle} accepts the element wins.
     */
    public <T extends CapabilityProvider> Optional<T> selectProvider(
            Class<T> capability, ElementHandle element, Language language) {
        var candidates = registrations.getOrDefault(capability, List.of());
        var base = language.base();
        var exact = new ArrayList<Registration>();
        var viaBase = new ArrayList<Registration>();
        var rest = new ArrayList<Registration>();
        for (var registration : candidates) {
            var tag = registration.provider().language();
            if (tag.equals(language)) {
                exact.add(registration);
            } else if (base != null && tag.equals(base)) {
                viaBase.add(registration);
            } else {
                rest.add(registration);
            }
        }

        for (var tier : List.of(exact, viaBase, rest)) {
            for (var registration : tier) {
                if (registration.available() && registration.provider().canHandle(element)) {
                    return Optional.of(capability.cast(registration.provider()));
                }
            }
        }
        logger.debug("No {} accepts {} ({})", capability.getSimpleName(), element, language);
        return Optional.empty();
    }

    /** All available providers of a capability, in registration order. */
    public <T extends CapabilityProvider> List<T> providers(Class<T> capability) {
        return registrations.getOrDefault(capability, List.of()).stream()
                .filter(Registration::available)
                .map(r -> capability.cast(r.provider()))
                .toList();
    }

    /** Language tags with an available provider for the capability, in registration order. */
    public Set<Language> supportedLanguages(Class<? extends CapabilityProvider> capability) {
        var languages = new LinkedHashSet<Language>();
        for (var registration : registrations.getOrDefault(capability, List.of())) {
            if (registration.available()) {
                languages.add(registration.provider().language());
            }
        }
        return languages;
    }
}
