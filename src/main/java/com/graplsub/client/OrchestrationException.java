package com.graplsub.client;

/**
 * Wraps a {@link TransportException} or {@link ResponseValidationException} with the pipeline
 * step that was running when it happened.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class OrchestrationException extends SubsonicException {

    /**
     * Steps of the playlist rebuild, in the order they run.
     */
    public enum Step {
        LIST_PLAYLISTS("Failed to list playlists"),
        DELETE_PLAYLIST("Failed to delete existing playlist"),
        CREATE_PLAYLIST("Failed to create playlist"),
        RANDOM_ALBUM_LIST("Failed to fetch random album list"),
        GET_ALBUM("Failed to fetch album"),
        UPDATE_PLAYLIST("Failed to add song to playlist");

        private final String description;

        Step(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Step step;
    private final String subjectId;

    public OrchestrationException(Step step, String subjectId, SubsonicException cause) {
        super(describe(step, subjectId) + ": " + cause.getMessage(), cause);
        this.step = step;
        this.subjectId = subjectId;
    }

    public OrchestrationException(Step step, SubsonicException cause) {
        this(step, null, cause);
    }

    private static String describe(Step step, String subjectId) {
        return subjectId == null ? step.description() : step.description() + " '" + subjectId + "'";
    }

    public Step getStep() {
        return step;
    }

    /**
     * @return id of the playlist, album or song involved, or null if the step has none
     */
    public String getSubjectId() {
        return subjectId;
    }

    @Override
    public synchronized SubsonicException getCause() {
        return (SubsonicException) super.getCause();
    }
}
