package com.devcrew.orchestrator.agent;

import java.util.Map;

/** Interface design stage: design → responsive layout → accessibility review. */
public interface UiUxAgent {

    Map<String, Object> designInterface(Map<String, Object> task);

    Map<String, Object> makeResponsive(Map<String, Object> design);

    Map<String, Object> checkAccessibility(Map<String, Object> implementation);
}
