package de.bsommerfeld.xivpatch.zipatch.sqpack;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;

/**
 * Identifies one pack file by category, sub category and file id. The
 * expansion folder is encoded in the high byte of the sub id.
 *
 * <p>
 * Example: main 0x0a, sub 0x0100, file 2 on win32 resolves to
 * {@code sqpack/ex1/0a0100.win32.dat2}.
 */
public record SqpackFile(int mainId, int subId, long fileId) {

    public static SqpackFile read(BinaryReader reader) {
        int mainId = reader.readU16BE();
        int subId = reader.readU16BE();
        long fileId = reader.readU32BE();
        return new SqpackFile(mainId, subId, fileId);
    }

    public int expansionId() {
        return subId >> 8;
    }

    /** Relative path of the data file, e.g. {@code sqpack/ffxiv/000000.win32.dat0}. */
    public String datPath(PlatformId platform) {
        return baseName(platform) + ".dat" + fileId;
    }

    /** Relative path of the index file; file id 0 is {@code .index}, others {@code .index{n}}. */
    public String indexPath(PlatformId platform) {
        return baseName(platform) + ".index" + (fileId == 0 ? "" : Long.toString(fileId));
    }

    private String baseName(PlatformId platform) {
        return String.format("sqpack/%s/%02x%04x.%s",
                expansionFolder(expansionId()), mainId, subId, platform.fileInfix());
    }

    /** Folder name of an expansion below {@code sqpack/} and {@code movie/}. */
    public static String expansionFolder(int expansionId) {
        return expansionId == 0 ? "ffxiv" : "ex" + expansionId;
    }
}
