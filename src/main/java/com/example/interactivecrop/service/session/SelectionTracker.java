package com.example.interactivecrop.service.session;

import com.example.interactivecrop.interaction.TargetSelection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class SelectionTracker implements TargetSelection {

    private final Set<String> selectedTargets = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isSelected(String targetId) {
        return selectedTargets.contains(targetId);
    }

    public void setSelected(String targetId, boolean selected) {
        if (selected) {
            selectedTargets.add(targetId);
        } else {
            selectedTargets.remove(targetId);
        }
    }
}
