package com.linlay.blockstream.serializer;

/**
 * @param records records written
 * @param batches sink writes issued
 * @param bytes   bytes written
 * @param waits   times the writer suspended on a full sink
 */
public record WriteReport(long records, int batches, long bytes, int waits) {
}
