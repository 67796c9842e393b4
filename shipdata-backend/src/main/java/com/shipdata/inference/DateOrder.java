package com.shipdata.inference;

/**
 * Field order used to read day/month dates such as {@code 01/02/2026}.
 */
public enum DateOrder {
    /**
     * US reading, MM/DD/YYYY. Default when a column never disambiguates itself.
     */
    MONTH_FIRST,
    /**
     * EU reading, DD/MM/YYYY.
     */
    DAY_FIRST
}
