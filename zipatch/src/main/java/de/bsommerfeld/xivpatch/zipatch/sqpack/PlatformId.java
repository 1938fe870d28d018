package de.bsommerfeld.xivpatch.zipatch.sqpack;

/**
 * Target platform of a patch. Selects the platform infix of pack file names.
 */
public enum PlatformId {

    WIN32(0, "win32"),
    PS3(1, "ps3"),
    PS4(2, "ps4");

    private final int id;
    private final String fileInfix;

    PlatformId(int id, String fileInfix) {
        this.id = id;
        this.fileInfix = fileInfix;
    }

    public int id() {
        return id;
    }

    public String fileInfix() {
        return fileInfix;
    }

    /**
     * @throws IllegalArgumentException for unknown platform ids
     */
    public static PlatformId fromId(int id) {
        for (PlatformId platform : values()) {
            if (platform.id == id) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform id: " + id);
    }
}
