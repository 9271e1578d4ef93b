package com.elssolution.meterhistory.integration.influx;

import com.influxdb.query.FluxRecord;

import java.util.List;

/** Thin read seam over the InfluxDB query API; lets the adapter be tested without a server. */
public interface ColumnarReadClient {

    /**
     * Runs a Flux script and returns all records of all result tables, in server order.
     *
     * @throws com.elssolution.meterhistory.integration.BackendUnavailableException if the server cannot answer
     */
    List<FluxRecord> query(String flux);
}
