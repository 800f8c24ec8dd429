package org.shaylang.compiler.backend;

import org.shaylang.compiler.backend.c.CCodeGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for the {@link BackendRegistry}.
 */
@Tag("unit")
class BackendRegistryTest {

    @Test
    void initializeWithDefaults_coversEveryFormat() {
        BackendRegistry registry = BackendRegistry.initializeWithDefaults();

        assertThat(registry.get(OutputFormat.C)).containsInstanceOf(CCodeGenerator.class);
        assertThat(registry.get(OutputFormat.JAVASCRIPT)).containsInstanceOf(UnimplementedCodeGenerator.class);
        assertThat(registry.get(OutputFormat.PYTHON)).containsInstanceOf(UnimplementedCodeGenerator.class);
        assertThat(registry.get(OutputFormat.BYTECODE)).containsInstanceOf(UnimplementedCodeGenerator.class);
    }

    @Test
    void resolve_fallsBackToUnimplementedGenerator() {
        BackendRegistry registry = BackendRegistry.initialize();

        assertThat(registry.get(OutputFormat.PYTHON)).isEmpty();
        assertThat(registry.resolve(OutputFormat.PYTHON)).isInstanceOf(UnimplementedCodeGenerator.class);
    }

    @Test
    void register_replacesExistingBackend() {
        BackendRegistry registry = BackendRegistry.initializeWithDefaults();
        ICodeGenerator custom = mock(ICodeGenerator.class);

        registry.register(OutputFormat.PYTHON, custom);

        assertThat(registry.resolve(OutputFormat.PYTHON)).isSameAs(custom);
    }
}
