package uk.gegc.quizforge.features.runner.domain.message;

/**
 * Message exchanged between an exercise runner and its frontends.
 * The order in which a runner emits messages is part of the protocol.
 */
public interface ExerciseMessage {

    /**
     * Name of the exercise, or a widget description, that sent the message.
     */
    String sender();
}
