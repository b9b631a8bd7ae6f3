package com.sommerph.zkinbox.model.submission;

import lombok.Value;

import java.util.List;

@Value
public class SubmissionPage {

    List<StoredSubmission> submissions;
    String nextCursor;
    int total;

}
