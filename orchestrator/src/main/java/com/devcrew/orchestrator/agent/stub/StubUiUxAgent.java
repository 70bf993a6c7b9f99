package com.devcrew.orchestrator.agent.stub;

import com.devcrew.orchestrator.agent.UiUxAgent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StubUiUxAgent implements UiUxAgent {

    @Override
    public Map<String, Object> designInterface(Map<String, Object> task) {
        Map<String, Object> design = new LinkedHashMap<>();
        design.put("task_id",    task.get("id"));
        design.put("components", List.of("header", "navigation", "content", "footer"));
        design.put("palette",    Map.of("primary", "#2962ff", "background", "#ffffff", "text", "#212121"));
        design.put("typography", "system-ui, 16px base");
        return design;
    }

    @Override
    public Map<String, Object> makeResponsive(Map<String, Object> design) {
        Map<String, Object> responsive = new LinkedHashMap<>(design);
        responsive.put("breakpoints", Map.of("mobile", 480, "tablet", 768, "desktop", 1200));
        responsive.put("layout", "single column below tablet, grid above");
        return responsive;
    }

    @Override
    public Map<String, Object> checkAccessibility(Map<String, Object> implementation) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("task_id",    implementation.get("task_id"));
        report.put("wcag_level", "AA");
        report.put("checks",     List.of("contrast", "keyboard navigation", "aria labels"));
        report.put("issues",     List.of());
        return report;
    }
}
