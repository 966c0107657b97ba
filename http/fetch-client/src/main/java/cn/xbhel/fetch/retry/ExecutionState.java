package cn.xbhel.fetch.retry;

/**
 * @author xbhel
 */
public enum ExecutionState {

    ATTEMPTING,
    EVALUATING,
    WAITING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

}
