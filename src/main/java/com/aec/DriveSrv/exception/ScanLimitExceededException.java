package com.aec.DriveSrv.exception;

import lombok.Getter;

/**
 * A recursive scan hit one of its ceilings. The scan is abandoned as a whole;
 * no partial listing is returned.
 */
@Getter
public class ScanLimitExceededException extends RuntimeException {

    public enum Ceiling {
        FOLDERS("folders"),
        FILES("eligible files");

        private final String label;

        Ceiling(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Ceiling ceiling;
    private final int limit;
    private final int foldersScanned;
    private final int filesCollected;

    public ScanLimitExceededException(Ceiling ceiling, int limit, int foldersScanned, int filesCollected) {
        super("Scan limit exceeded: max " + limit + " " + ceiling.label()
                + " (stopped after " + foldersScanned + " folders and " + filesCollected + " eligible files)");
        this.ceiling = ceiling;
        this.limit = limit;
        this.foldersScanned = foldersScanned;
        this.filesCollected = filesCollected;
    }
}
