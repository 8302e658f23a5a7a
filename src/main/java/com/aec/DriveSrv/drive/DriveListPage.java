package com.aec.DriveSrv.drive;

import java.util.List;

public record DriveListPage(List<DriveItem> items, String nextPageToken) {

    public DriveListPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
