package com.example.interactivecrop.service.remote;

import com.example.interactivecrop.exception.DecisionSubmissionException;
import com.example.interactivecrop.service.session.CropDecision;

public interface DecisionSink {

    /**
     * @return whether the remote side accepted the decision
     * @throws DecisionSubmissionException when the decision could not be delivered at all
     */
    boolean submit(CropDecision decision) throws DecisionSubmissionException;
}
