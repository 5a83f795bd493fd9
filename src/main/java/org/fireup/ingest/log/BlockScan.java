package org.fireup.ingest.log;

import java.util.List;

import org.fireup.ingest.api.DecodeError;

/**
 * Records and local errors found while scanning one block.
 *
 * @param records valid records in block order
 * @param errors  one error per corrupted region of the block
 */
public record BlockScan(List<RawRecord> records, List<DecodeError> errors) {

    public BlockScan {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }
}
