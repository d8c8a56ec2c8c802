package com.taxledger.domain;

/**
 * Form lines of Anlage KAP, KAP-INV and SO that realized results and income are bucketed into.
 */
public enum TaxReportingCategory {
    ANLAGE_KAP_AKTIEN_GEWINN,
    ANLAGE_KAP_AKTIEN_VERLUST,
    ANLAGE_KAP_TERMIN_GEWINN,
    ANLAGE_KAP_TERMIN_VERLUST,
    ANLAGE_KAP_SONSTIGE_KAPITALERTRAEGE,
    ANLAGE_KAP_SONSTIGE_VERLUSTE,
    /** Zeile 19: foreign capital income total; derivative losses are not netted here. */
    ANLAGE_KAP_AUSLAENDISCHE_KAPITALERTRAEGE_GESAMT,
    ANLAGE_KAP_FOREIGN_TAX_PAID,

    KAP_INV_AKTIENFONDS_AUSSCHUETTUNG_GROSS,
    KAP_INV_AKTIENFONDS_GEWINN_GROSS,
    KAP_INV_AKTIENFONDS_VORABPAUSCHALE_BRUTTO,
    KAP_INV_MISCHFONDS_AUSSCHUETTUNG_GROSS,
    KAP_INV_MISCHFONDS_GEWINN_GROSS,
    KAP_INV_MISCHFONDS_VORABPAUSCHALE_BRUTTO,
    KAP_INV_IMMOBILIENFONDS_AUSSCHUETTUNG_GROSS,
    KAP_INV_IMMOBILIENFONDS_GEWINN_GROSS,
    KAP_INV_IMMOBILIENFONDS_VORABPAUSCHALE_BRUTTO,
    KAP_INV_AUSLANDS_IMMOBILIENFONDS_AUSSCHUETTUNG_GROSS,
    KAP_INV_AUSLANDS_IMMOBILIENFONDS_GEWINN_GROSS,
    KAP_INV_AUSLANDS_IMMOBILIENFONDS_VORABPAUSCHALE_BRUTTO,
    KAP_INV_SONSTIGE_FONDS_AUSSCHUETTUNG_GROSS,
    KAP_INV_SONSTIGE_FONDS_GEWINN_GROSS,
    KAP_INV_SONSTIGE_FONDS_VORABPAUSCHALE_BRUTTO,

    SECTION_23_ESTG_TAXABLE_GAIN,
    SECTION_23_ESTG_TAXABLE_LOSS,
    SECTION_23_ESTG_EXEMPT_HOLDING_PERIOD_MET,
    /** Anlage SO Zeile 54: net §23 gain/loss. */
    ANLAGE_SO_Z54_NET_GV,

    NON_TAXABLE_OTHER
}
