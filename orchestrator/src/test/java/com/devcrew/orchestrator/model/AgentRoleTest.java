package com.devcrew.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRoleTest {

    @Test
    void fromAgentId_resolvesMultiWordRoles() {
        assertThat(AgentRole.fromAgentId("project_manager_1a2b3c4d")).isEqualTo(AgentRole.PROJECT_MANAGER);
        assertThat(AgentRole.fromAgentId("ui_ux_deadbeef")).isEqualTo(AgentRole.UI_UX);
        assertThat(AgentRole.fromAgentId("error_handling_00000000")).isEqualTo(AgentRole.ERROR_HANDLING);
        assertThat(AgentRole.fromAgentId("testing_abc")).isEqualTo(AgentRole.TESTING);
    }

    @Test
    void fromAgentId_acceptsBareRoleNameAndSystemSender() {
        assertThat(AgentRole.fromAgentId("developer")).isEqualTo(AgentRole.DEVELOPER);
        assertThat(AgentRole.fromAgentId("system")).isEqualTo(AgentRole.PROJECT_MANAGER);
    }

    @Test
    void fromAgentId_unknownPrefix_throws() {
        assertThatThrownBy(() -> AgentRole.fromAgentId("janitor_1234"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromWireName_isCaseInsensitiveAndAcceptsEnumNames() {
        assertThat(AgentRole.fromWireName("Ui_Ux")).isEqualTo(AgentRole.UI_UX);
        assertThat(AgentRole.fromWireName("ERROR_HANDLING")).isEqualTo(AgentRole.ERROR_HANDLING);
    }

    @Test
    void pipeline_startsWithProjectManagerAndEndsWithErrorHandling() {
        assertThat(AgentRole.pipeline()).hasSize(7)
                .startsWith(AgentRole.PROJECT_MANAGER)
                .endsWith(AgentRole.ERROR_HANDLING);
    }
}
