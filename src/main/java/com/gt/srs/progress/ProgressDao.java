package com.gt.srs.progress;

import com.gt.srs.model.Progress;
import com.gt.srs.model.ProgressKey;

import java.util.List;
import java.util.Optional;

public interface ProgressDao {

    Optional<Progress> loadProgress(ProgressKey key);

    /**
     * Stores {@code progress} only if the stored row is still the one it was computed from. A progress
     * with version 1 is inserted and must not exist yet; any later version replaces the row holding
     * {@code version - 1}.
     *
     * @return false when another update won the race and nothing was written
     */
    boolean saveProgress(Progress progress);

    List<Progress> loadLearnerProgress(long learnerId);
}
