package com.example.interactivecrop.service;

import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.interaction.DragLock;
import com.example.interactivecrop.interaction.PointerInput;
import com.example.interactivecrop.model.CropRequest;
import com.example.interactivecrop.model.DecisionResponse;
import com.example.interactivecrop.model.LayoutRequest;
import com.example.interactivecrop.model.PointerEventRequest;
import com.example.interactivecrop.model.PointerEventRequest.PointerPhase;
import com.example.interactivecrop.model.PointerResponse;
import com.example.interactivecrop.model.ReleaseRequest.ReleaseReason;
import com.example.interactivecrop.model.ReleaseResponse;
import com.example.interactivecrop.model.RenderFrame;
import com.example.interactivecrop.service.remote.DecisionSink;
import com.example.interactivecrop.service.remote.ImageLoader;
import com.example.interactivecrop.service.session.CropBounds;
import com.example.interactivecrop.service.session.CropDecision;
import com.example.interactivecrop.service.session.CropSession;
import com.example.interactivecrop.service.session.DecisionAction;
import com.example.interactivecrop.service.session.SelectionTracker;
import com.example.interactivecrop.service.session.SessionManager;
import com.example.interactivecrop.util.PreviewCropper;
import java.awt.image.BufferedImage;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything the host forwards: crop requests, layout, pointer and selection
 * events, and decisions.
 *
 * <p>All session mutations run under a single monitor so that no two events interleave inside a
 * drag transition. Image loading and the outbound decision call run outside it.</p>
 */
@Service
public class CropInteractionService {

    private static final Logger log = LoggerFactory.getLogger(CropInteractionService.class);

    private final Object monitor = new Object();
    private final SessionManager sessionManager;
    private final SelectionTracker selectionTracker;
    private final DragLock dragLock;
    private final ImageLoader imageLoader;
    private final DecisionSink decisionSink;

    public CropInteractionService(SessionManager sessionManager,
                                  SelectionTracker selectionTracker,
                                  DragLock dragLock,
                                  ImageLoader imageLoader,
                                  DecisionSink decisionSink) {
        this.sessionManager = sessionManager;
        this.selectionTracker = selectionTracker;
        this.dragLock = dragLock;
        this.imageLoader = imageLoader;
        this.decisionSink = decisionSink;
    }

    public Optional<RenderFrame> open(CropRequest request) {
        CropSession session;
        synchronized (monitor) {
            Optional<CropSession> opened = sessionManager.open(request);
            if (opened.isEmpty()) {
                return Optional.empty();
            }
            session = opened.get();
        }
        imageLoader.load(session.image(), image -> onPreviewLoaded(session, image));
        synchronized (monitor) {
            return Optional.of(session.toFrame());
        }
    }

    public RenderFrame layout(String targetId, LayoutRequest request) {
        synchronized (monitor) {
            CropSession session = sessionManager.require(targetId);
            session.applyLayout(request);
            return session.toFrame();
        }
    }

    public RenderFrame drawBox(String targetId, DrawBox drawBox) {
        synchronized (monitor) {
            CropSession session = sessionManager.require(targetId);
            session.applyDrawBox(drawBox);
            return session.toFrame();
        }
    }

    public PointerResponse pointer(String targetId, PointerEventRequest event) {
        PointerInput input = event.toInput();
        synchronized (monitor) {
            CropSession session = sessionManager.require(targetId);
            boolean claimed;
            if (event.phase() == PointerPhase.DOWN) {
                claimed = session.onPointerDown(input);
            } else if (event.phase() == PointerPhase.MOVE) {
                claimed = session.onPointerMove(input);
            } else {
                claimed = session.onPointerUp(input);
            }
            return new PointerResponse(claimed, session.toFrame());
        }
    }

    public ReleaseResponse forceRelease(ReleaseReason reason) {
        synchronized (monitor) {
            Optional<String> owner = dragLock.owner();
            boolean released = dragLock.forceRelease();
            if (released) {
                log.debug("Force released drag of {} on {}", owner.orElse(null), reason);
            }
            return new ReleaseResponse(released, released ? owner.orElse(null) : null);
        }
    }

    public void select(String targetId, boolean selected) {
        synchronized (monitor) {
            selectionTracker.setSelected(targetId, selected);
            if (!selected && dragLock.isHeldBy(targetId)) {
                log.debug("Target {} deselected while dragging", targetId);
                dragLock.forceRelease();
            }
        }
    }

    public RenderFrame aspectLock(String targetId, boolean forceOriginalRatio) {
        synchronized (monitor) {
            CropSession session = sessionManager.require(targetId);
            session.setAspectLock(forceOriginalRatio);
            return session.toFrame();
        }
    }

    public RenderFrame frame(String targetId) {
        synchronized (monitor) {
            return sessionManager.require(targetId).toFrame();
        }
    }

    public Optional<BufferedImage> previewImage(String targetId) {
        synchronized (monitor) {
            return sessionManager.require(targetId).preview();
        }
    }

    /**
     * Submits a decision. The session is marked submitted before the remote call, so a second
     * decision for the same session is ignored even while the first one is in flight.
     */
    public DecisionResponse decide(String targetId, DecisionAction action) {
        CropSession session;
        CropDecision decision;
        synchronized (monitor) {
            session = sessionManager.require(targetId);
            Optional<CropDecision> pending = session.beginSubmission(action);
            if (pending.isEmpty()) {
                return DecisionResponse.ignored(session.toFrame());
            }
            decision = pending.get();
        }

        boolean delivered = decisionSink.submit(decision);

        synchronized (monitor) {
            if (delivered && decision.action() == DecisionAction.CONTINUE && sessionManager.isCurrent(session)) {
                showCroppedPreview(session, decision.rect());
            }
            return DecisionResponse.sent(decision, session.toFrame());
        }
    }

    public boolean close(String targetId) {
        synchronized (monitor) {
            selectionTracker.setSelected(targetId, false);
            return sessionManager.close(targetId);
        }
    }

    private void onPreviewLoaded(CropSession session, BufferedImage image) {
        synchronized (monitor) {
            if (!sessionManager.isCurrent(session)) {
                log.debug("Discarding preview for replaced session {} (request {})", session.targetId(), session.requestId());
                return;
            }
            session.markReady(image);
        }
    }

    private void showCroppedPreview(CropSession session, CropBounds bounds) {
        session.preview().ifPresent(preview -> {
            BufferedImage cropped = PreviewCropper.crop(preview, bounds,
                    session.machine().imageWidth(), session.machine().imageHeight());
            session.applyPreview(cropped, bounds);
        });
    }
}
