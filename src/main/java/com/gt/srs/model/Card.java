package com.gt.srs.model;

import java.time.Instant;

// baseDifficulty and explanation are optional and may be null
public record Card(long id,
                   String prompt,
                   String answer,
                   String explanation,
                   String scope,
                   Double baseDifficulty,
                   CardSource source,
                   Instant createdAt) { }
