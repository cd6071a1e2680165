package dev.vigil.service;

import dev.vigil.infrastructure.gateway.GatewayClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModelSelectionServiceTest {

    private GatewayClient gateway;
    private ModelSelectionService service;

    @BeforeEach
    void setUp() {
        gateway = mock(GatewayClient.class);
        when(gateway.isConnected()).thenReturn(true);
        service = new ModelSelectionService(gateway);
    }

    @Test
    @DisplayName("selects the first model when nothing is selected yet")
    void selectsFirst() {
        when(gateway.refreshModels(false)).thenReturn(List.of("a", "b"));

        service.refresh(false);

        assertThat(service.selectedModel()).contains("a");
    }

    @Test
    @DisplayName("keeps the selection while it is still advertised")
    void keepsSelection() {
        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of("a", "b"));
        service.refresh(false);
        service.select("b");

        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of("c", "b"));
        service.refresh(true);

        assertThat(service.selectedModel()).contains("b");
    }

    @Test
    @DisplayName("replaces a selection that disappeared")
    void replacesVanished() {
        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of("a"));
        service.refresh(false);

        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of("z"));
        service.refresh(false);

        assertThat(service.selectedModel()).contains("z");
    }

    @Test
    @DisplayName("clears the selection when the server goes away")
    void clearsWhenOffline() {
        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of("a"));
        service.refresh(false);

        when(gateway.isConnected()).thenReturn(false);
        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of());
        service.refresh(false);

        assertThat(service.selectedModel()).isEmpty();
    }

    @Test
    @DisplayName("rejects models the server does not advertise")
    void rejectsUnknownModel() {
        when(gateway.refreshModels(anyBoolean())).thenReturn(List.of("a"));

        assertThatThrownBy(() -> service.select("gpt-4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gpt-4");
    }

    @Test
    @DisplayName("status line reflects the connection")
    void statusLine() {
        when(gateway.models()).thenReturn(List.of("a", "b"));
        assertThat(service.statusLine()).isEqualTo("LM Studio connected (2 models)");

        when(gateway.isConnected()).thenReturn(false);
        when(gateway.lastError()).thenReturn("Can't connect to LM Studio. Is it running?");
        assertThat(service.statusLine()).isEqualTo("LM Studio offline (Can't connect to LM Studio. Is it running?)");
    }
}
