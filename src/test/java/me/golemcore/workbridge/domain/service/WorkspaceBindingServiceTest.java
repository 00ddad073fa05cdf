package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceBindingServiceTest {

    private WorkbridgeProperties properties;
    private WorkspaceBindingService service;

    @BeforeEach
    void setUp() {
        properties = new WorkbridgeProperties();
        service = new WorkspaceBindingService(properties);
    }

    private WorkbridgeProperties.WorkspaceProperties workspace(String id, boolean enabled, String... recipients) {
        WorkbridgeProperties.WorkspaceProperties workspace = new WorkbridgeProperties.WorkspaceProperties();
        workspace.setEnabled(enabled);
        workspace.setRecipients(List.of(recipients));
        properties.getWorkspaces().put(id, workspace);
        return workspace;
    }

    @Test
    void shouldFindWorkspaceOfRecipient() {
        workspace("frontend", true, "1", "2");
        workspace("backend", true, "3");

        assertEquals(Optional.of("backend"), service.findWorkspaceFor("3"));
    }

    @Test
    void shouldSkipDisabledWorkspaces() {
        workspace("frontend", false, "1");

        assertTrue(service.findWorkspaceFor("1").isEmpty());
    }

    @Test
    void shouldReturnRecipientsOfWorkspace() {
        workspace("frontend", true, "1", "2");

        assertEquals(List.of("1", "2"), service.getRecipients("frontend"));
        assertTrue(service.getRecipients("unknown").isEmpty());
    }
}
