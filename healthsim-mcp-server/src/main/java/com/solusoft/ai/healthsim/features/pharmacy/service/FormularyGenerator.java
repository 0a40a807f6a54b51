package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;
import com.solusoft.ai.healthsim.features.pharmacy.model.TierCostShare;

/**
 * Builds the sample commercial and Medicare Part D formularies.
 */
public class FormularyGenerator {

    public static final String COMMERCIAL = "commercial";
    public static final String MEDICARE = "medicare";

    private static final String METFORMIN_CLASS = "2725";
    private static final String PPI_CLASS = "4927";
    private static final String WEGOVY_NDC = "61958060101";
    private static final String LATISSE_NDC = "00023361605";

    public Formulary generate(String name) {
        switch (name == null ? COMMERCIAL : name.trim().toLowerCase(Locale.ROOT)) {
            case COMMERCIAL:
                return generateStandardCommercial();
            case MEDICARE:
            case "medicare_part_d":
                return generateMedicarePartD();
            default:
                throw new UnknownReferenceException("formulary", name);
        }
    }

    public Formulary generateStandardCommercial() {
        List<TierCostShare> tiers = List.of(
                new TierCostShare(1, "Preferred Generic", new BigDecimal("10.00"), null, false),
                new TierCostShare(2, "Non-Preferred Generic", new BigDecimal("25.00"), null, false),
                new TierCostShare(3, "Preferred Brand", new BigDecimal("40.00"), null, true),
                new TierCostShare(4, "Non-Preferred Brand", new BigDecimal("80.00"), null, true),
                new TierCostShare(5, "Specialty", null, 25, true));
        return new Formulary("COMM2025", "Standard Commercial Formulary", drugs(false), tiers);
    }

    public Formulary generateMedicarePartD() {
        List<TierCostShare> tiers = List.of(
                new TierCostShare(1, "Preferred Generic", new BigDecimal("0.00"), null, false),
                new TierCostShare(2, "Generic", new BigDecimal("10.00"), null, false),
                new TierCostShare(3, "Preferred Brand", new BigDecimal("47.00"), null, true),
                new TierCostShare(4, "Non-Preferred Drug", null, 40, true),
                new TierCostShare(5, "Specialty", null, 25, true));
        return new Formulary("PARTD2025", "Medicare Part D Formulary", drugs(true), tiers);
    }

    private static List<FormularyDrug> drugs(boolean medicare) {
        List<FormularyDrug> drugs = new ArrayList<>();
        // Tier 1
        drugs.add(open("00093017101", "27250050000310", "Metformin HCl 500 MG Tablet", 1, "4"));
        drugs.add(open("68180051301", "36100030000310", "Lisinopril 10 MG Tablet", 1, "4"));
        drugs.add(open("00071015523", "39400010000310", "Atorvastatin Calcium 10 MG Tablet", 1, "8"));
        drugs.add(open("00093715410", "39400075000320", "Simvastatin 20 MG Tablet", 1, "4"));
        drugs.add(open("00078057715", "39400060100310", "Rosuvastatin Calcium 10 MG Tablet", 1, "4"));
        drugs.add(open("00069152030", "34000003000310", "Amlodipine Besylate 5 MG Tablet", 1, "2"));
        drugs.add(open("00056017270", "83200030200315", "Warfarin Sodium 5 MG Tablet", 1, "3"));
        drugs.add(open("00904515260", "66100010000310", "Ibuprofen 800 MG Tablet", 1, "4"));
        drugs.add(open("00093014901", "66100060100310", "Naproxen 500 MG Tablet", 1, "2"));
        drugs.add(open("16729011401", "58160070100320", "Sertraline HCl 50 MG Tablet", 1, "4"));
        drugs.add(open("62175011843", "49270060006520", "Omeprazole 20 MG Capsule DR", 1, "2"));
        drugs.add(open("00378180001", "28100010100310", "Levothyroxine Sodium 50 MCG Tablet", 1, "2"));
        drugs.add(open("00054429725", "37200030000310", "Furosemide 40 MG Tablet", 1, "4"));
        drugs.add(open("00378211601", "37500050000310", "Spironolactone 25 MG Tablet", 1, "4"));
        drugs.add(open("00186108805", "33200030057530", "Metoprolol Succinate ER 50 MG Tablet", 1, "4"));
        drugs.add(open("00093716056", "03400010000320", "Azithromycin 250 MG Tablet", 1, "2"));
        drugs.add(open("00006011731", "56851030000310", "Finasteride 5 MG Tablet", 1, "1"));
        drugs.add(limited("00093720856", "67406070100320", "Sumatriptan Succinate 50 MG Tablet", 1, 9, 30, "4"));
        // Tier 2
        drugs.add(open("00093708001", "03400005000310", "Clarithromycin 500 MG Tablet", 2, "2"));
        drugs.add(open("00228266711", "72600030000110", "Gabapentin 300 MG Capsule", 2, "12"));
        drugs.add(limited("00093005801", "65100095100320", "Tramadol HCl 50 MG Tablet", 2, 240, 30, "8"));
        drugs.add(limited("00591024101", "57100060000310", "Lorazepam 1 MG Tablet", 2, 90, 30, "4"));
        drugs.add(open("00228202910", "57100010000305", "Alprazolam 0.5 MG Tablet", 2, "8"));
        drugs.add(open("62037059101", "32100030107510", "Isosorbide Mononitrate ER 30 MG Tablet", 2, "2"));
        drugs.add(open("00143314250", "04000020100105", "Doxycycline Hyclate 100 MG Capsule", 2, "2"));
        drugs.add(open("59762003301", "40143060100310", "Sildenafil Citrate 20 MG Tablet", 2, "3"));
        // Tier 3
        drugs.add(open("00003089421", "83370010000330", "Eliquis 5 MG Tablet", 3, "2"));
        drugs.add(stepped("00597015230", "27700050000310", "Jardiance 10 MG Tablet", 3, METFORMIN_CLASS, "1"));
        drugs.add(new FormularyDrug("00002141080", "27170020002030", "Trulicity 1.5 MG/0.5 ML Pen", 3,
                true, true, true, METFORMIN_CLASS, 2, 28, null));
        // Tier 4
        drugs.add(open("00071015540", "39400010000310", "Lipitor 10 MG Tablet", 4, "8"));
        drugs.add(stepped("00186504031", "49270025106520", "Nexium 40 MG Capsule DR", 4, PPI_CLASS, "2"));
        drugs.add(new FormularyDrug(WEGOVY_NDC, "61253560002020", "Wegovy 2.4 MG/0.75 ML Pen", 4,
                !medicare, true, false, null, 3, 28, null));
        drugs.add(new FormularyDrug(LATISSE_NDC, "90920010002020", "Latisse 0.03% Solution", 4,
                false, false, false, null, null, null, null));
        // Tier 5
        drugs.add(new FormularyDrug("00169413512", "27170070002020", "Ozempic 0.5 MG/DOSE Pen", 5,
                true, true, true, METFORMIN_CLASS, 3, 28, null));
        drugs.add(new FormularyDrug("00074433902", "66270015002020", "Humira 40 MG/0.8 ML Pen", 5,
                true, true, false, null, 2, 28, null));
        drugs.add(new FormularyDrug("58406043504", "66290030002020", "Enbrel 50 MG/ML SureClick", 5,
                true, true, false, null, 4, 28, null));
        return drugs;
    }

    private static FormularyDrug open(String ndc, String gpi, String name, int tier, String maxDaily) {
        return new FormularyDrug(ndc, gpi, name, tier, true, false, false, null, null, null,
                new BigDecimal(maxDaily));
    }

    private static FormularyDrug limited(String ndc, String gpi, String name, int tier,
            int quantity, int days, String maxDaily) {
        return new FormularyDrug(ndc, gpi, name, tier, true, false, false, null, quantity, days,
                new BigDecimal(maxDaily));
    }

    private static FormularyDrug stepped(String ndc, String gpi, String name, int tier,
            String prerequisite, String maxDaily) {
        return new FormularyDrug(ndc, gpi, name, tier, true, false, true, prerequisite, null, null,
                new BigDecimal(maxDaily));
    }
}
