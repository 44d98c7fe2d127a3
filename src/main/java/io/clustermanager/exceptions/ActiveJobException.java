package io.clustermanager.exceptions;

/**
 * Thrown when a job is requested while another cluster-mutating job is still active.
 */
public class ActiveJobException extends ClusterManagerException {

    private final String activeJobDescription;

    public ActiveJobException(String activeJobDescription) {
        super("there is already an active job, please try in sometime. Job: " + activeJobDescription);
        this.activeJobDescription = activeJobDescription;
    }

    public String getActiveJobDescription() {
        return activeJobDescription;
    }
}
