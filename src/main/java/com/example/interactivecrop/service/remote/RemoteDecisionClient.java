package com.example.interactivecrop.service.remote;

import com.example.interactivecrop.config.CropProperties;
import com.example.interactivecrop.exception.DecisionSubmissionException;
import com.example.interactivecrop.service.session.CropBounds;
import com.example.interactivecrop.service.session.CropDecision;
import com.example.interactivecrop.service.session.DecisionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class RemoteDecisionClient implements DecisionSink {

    private static final Logger log = LoggerFactory.getLogger(RemoteDecisionClient.class);

    private final RestTemplate restTemplate;
    private final String submitPath;

    public RemoteDecisionClient(RestTemplate restTemplate, CropProperties properties) {
        this.restTemplate = restTemplate;
        this.submitPath = properties.remote().submitPath();
    }

    @Override
    public boolean submit(CropDecision decision) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("prompt_id", decision.requestId());
        form.add("node_id", decision.targetId());
        form.add("action", decision.action().wireValue());
        if (decision.action() == DecisionAction.CONTINUE && decision.rect() != null) {
            CropBounds rect = decision.rect();
            form.add("x0", Integer.toString(rect.x0()));
            form.add("y0", Integer.toString(rect.y0()));
            form.add("x1", Integer.toString(rect.x1()));
            form.add("y1", Integer.toString(rect.y1()));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        SubmitReply reply;
        try {
            reply = restTemplate.postForObject(submitPath, new HttpEntity<>(form, headers), SubmitReply.class);
        } catch (RestClientException ex) {
            throw new DecisionSubmissionException(
                    "Failed to submit " + decision.action().wireValue() + " for target " + decision.targetId(), ex);
        }

        if (reply == null || !reply.ok()) {
            log.warn("Remote rejected {} for request {} target {}: {}",
                    decision.action().wireValue(), decision.requestId(), decision.targetId(),
                    reply == null ? "empty reply" : reply.error());
            return false;
        }
        log.info("Sent {} for request {} target {}", decision.action().wireValue(), decision.requestId(), decision.targetId());
        return true;
    }
}
