package nl.pim16aap2.protonkeeper.manager;

import dagger.BindsInstance;
import dagger.Component;
import nl.pim16aap2.protonkeeper.manager.config.RuntimeManagerConfig;
import nl.pim16aap2.protonkeeper.manager.registry.RuntimeRegistry;
import nl.pim16aap2.protonkeeper.manager.system.SystemRuntimeProbe;

import javax.inject.Singleton;

/**
 * Dagger component wiring the runtime manager services.
 * <p>
 * Use {@code DaggerRuntimeManagerComponent.factory()} to supply a custom registry or system runtime probe.
 */
@Singleton
@Component
public interface RuntimeManagerComponent
{
    RuntimeManager runtimeManager();

    @Component.Factory
    interface Factory
    {
        RuntimeManagerComponent create(
            @BindsInstance RuntimeManagerConfig config,
            @BindsInstance RuntimeRegistry registry,
            @BindsInstance SystemRuntimeProbe systemRuntimeProbe
        );
    }
}
