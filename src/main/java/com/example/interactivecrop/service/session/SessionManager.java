package com.example.interactivecrop.service.session;

import com.example.interactivecrop.config.CropProperties;
import com.example.interactivecrop.exception.SessionNotFoundException;
import com.example.interactivecrop.interaction.DragLock;
import com.example.interactivecrop.interaction.TargetSelection;
import com.example.interactivecrop.model.CropRequest;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, CropSession> sessions = new ConcurrentHashMap<>();
    private final DragLock dragLock;
    private final TargetSelection targetSelection;
    private final CropProperties properties;

    public SessionManager(DragLock dragLock, TargetSelection targetSelection, CropProperties properties) {
        this.dragLock = dragLock;
        this.targetSelection = targetSelection;
        this.properties = properties;
    }

    /**
     * Opens a session for a crop request, replacing any session the target already has.
     * Incomplete requests are ignored.
     */
    public Optional<CropSession> open(CropRequest request) {
        if (request == null || !request.isComplete()) {
            log.debug("Ignoring incomplete crop request {}", request);
            return Optional.empty();
        }
        CropSession session = new CropSession(request, dragLock, targetSelection, properties.layout());
        CropSession previous = sessions.put(request.targetId(), session);
        if (previous != null) {
            previous.close();
            log.info("Crop session for target {} replaced (request {} -> {})",
                    request.targetId(), previous.requestId(), request.requestId());
        } else {
            log.info("Crop session opened for target {} (request {}, {}x{})",
                    request.targetId(), request.requestId(), request.width(), request.height());
        }
        return Optional.of(session);
    }

    public Optional<CropSession> find(String targetId) {
        return Optional.ofNullable(sessions.get(targetId));
    }

    public CropSession require(String targetId) {
        return find(targetId).orElseThrow(() -> new SessionNotFoundException(targetId));
    }

    public boolean close(String targetId) {
        CropSession session = sessions.remove(targetId);
        if (session == null) {
            return false;
        }
        session.close();
        log.info("Crop session closed for target {}", targetId);
        return true;
    }

    public boolean isCurrent(CropSession session) {
        return sessions.get(session.targetId()) == session;
    }
}
