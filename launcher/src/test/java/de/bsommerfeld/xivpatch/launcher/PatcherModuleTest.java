package de.bsommerfeld.xivpatch.launcher;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.xivpatch.core.config.DownloadConfig;
import de.bsommerfeld.xivpatch.core.config.PatcherConfig;
import de.bsommerfeld.xivpatch.updater.update.UpdateCoordinator;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchInstaller;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static org.junit.jupiter.api.Assertions.*;

class PatcherModuleTest {

    @Test
    void injector_shouldWireCoordinatorAsSingleton() {
        PatcherConfig config = new PatcherConfig();
        Injector injector = Guice.createInjector(new PatcherModule(config));

        UpdateCoordinator first = injector.getInstance(UpdateCoordinator.class);
        UpdateCoordinator second = injector.getInstance(UpdateCoordinator.class);

        assertSame(first, second);
        first.shutdown();
    }

    @Test
    void injector_shouldBindConfigSections() {
        PatcherConfig config = new PatcherConfig();
        Injector injector = Guice.createInjector(new PatcherModule(config));

        assertSame(config, injector.getInstance(PatcherConfig.class));
        assertSame(config.getDownload(), injector.getInstance(DownloadConfig.class));
        assertSame(injector.getInstance(HttpClient.class), injector.getInstance(HttpClient.class));
        assertNotNull(injector.getInstance(ZiPatchInstaller.class));
    }
}
