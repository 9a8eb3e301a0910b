package com.gt.recall.session.model;

import com.gt.recall.model.ReviewEvent;

public record SubmissionResult(ReviewEvent event,
                               boolean requeued,
                               int remainingInQueue) { }
