package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.plugin.api.MessagePlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PluginRegistryTest {

    private final List<MessagePlugin> installed = new ArrayList<>();
    private PluginRegistry registry;
    private CombinedMessage message;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ObjectProvider<MessagePlugin> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenAnswer(invocation -> installed.stream());
        registry = new PluginRegistry(provider);
        message = CombinedMessage.single(InboundEvent.builder().conversationId("100").eventId(1)
                .kind(ContentKind.TEXT).text("hello").build(), null);
    }

    @Test
    void shouldReturnFalseWithoutPlugins() throws Exception {
        assertFalse(registry.tryHandle(message));
    }

    @Test
    void shouldStopAtFirstClaimingPlugin() throws Exception {
        MessagePlugin first = plugin("first");
        MessagePlugin second = plugin("second");
        when(first.tryHandle(message)).thenReturn(true);

        assertTrue(registry.tryHandle(message));
        verify(second, never()).tryHandle(any());
    }

    @Test
    void shouldTreatFailingPluginAsUnclaimed() throws Exception {
        MessagePlugin broken = plugin("broken");
        MessagePlugin next = plugin("next");
        when(broken.tryHandle(message)).thenThrow(new IllegalStateException("boom"));
        when(next.tryHandle(message)).thenReturn(true);

        assertTrue(registry.tryHandle(message));
    }

    @Test
    void shouldPropagateInterruption() throws Exception {
        MessagePlugin plugin = plugin("slow");
        when(plugin.tryHandle(message)).thenThrow(new InterruptedException());

        assertThrows(InterruptedException.class, () -> registry.tryHandle(message));
    }

    private MessagePlugin plugin(String name) {
        MessagePlugin plugin = mock(MessagePlugin.class);
        when(plugin.getName()).thenReturn(name);
        installed.add(plugin);
        return plugin;
    }
}
