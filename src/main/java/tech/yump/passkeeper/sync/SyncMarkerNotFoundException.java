package tech.yump.passkeeper.sync;

import tech.yump.passkeeper.core.NotFoundException;

public class SyncMarkerNotFoundException extends NotFoundException {

    public SyncMarkerNotFoundException() {
        super("sync timestamp not found");
    }
}
