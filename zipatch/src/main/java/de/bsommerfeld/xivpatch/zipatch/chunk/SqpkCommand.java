package de.bsommerfeld.xivpatch.zipatch.chunk;

/**
 * {@code SQPK} chunks carry a one-character command that selects the actual
 * operation. Most of them work on pack files below {@code sqpack/}.
 */
public sealed interface SqpkCommand extends Chunk permits SqpkAddData, SqpkDeleteData, SqpkExpandData,
        SqpkHeader, SqpkIndex, SqpkAddFile, SqpkDeleteFile, SqpkRemoveAll, SqpkMakeDirTree,
        SqpkTargetInfo, SqpkPatchInfo {

    char command();

    @Override
    default String type() {
        return "SQPK:" + command();
    }
}
