package com.tgupgrade.core.renderer;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the renderers are registered for {@link ServiceLoader} discovery.
 */
class RendererServiceLoaderTest {

    @Test
    void serviceLoader_discoversAllOutputModes() {
        List<String> ids = new ArrayList<>();
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            ids.add(renderer.getId());
        }

        assertThat(ids).containsExactlyInAnyOrder("in-place", "dry-run", "git-mv");
    }

    @Test
    void upgradedFile_target_resolvesNextToSource() {
        UpgradedFile file = new UpgradedFile(Paths.get("live", "app", "terraform.tfvars"), "");

        assertThat(file.target("terragrunt.hcl"))
            .isEqualTo(Paths.get("live", "app", "terragrunt.hcl"));
    }

    @Test
    void renderContext_settingDefaults() {
        RenderContext context = new RenderContext("terragrunt.hcl", null);

        assertThat(context.getSetting("missing")).isNull();
        assertThat(context.getSettingOrDefault("missing", "x")).isEqualTo("x");
    }
}
