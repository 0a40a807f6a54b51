package com.solusoft.ai.healthsim.common.generator;

import java.time.LocalDate;
import java.util.List;

import com.solusoft.ai.healthsim.common.model.Address;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;

/**
 * Fabricates names, birth dates, addresses and phone numbers from fixed lists.
 */
public class DemographicsGenerator {

    private static final List<String> MALE_FIRST_NAMES = List.of(
            "James", "Robert", "John", "Michael", "David", "William", "Richard", "Joseph", "Thomas", "Charles",
            "Daniel", "Matthew", "Anthony", "Mark", "Steven", "Andrew", "Joshua", "Kevin", "Brian", "Luis");

    private static final List<String> FEMALE_FIRST_NAMES = List.of(
            "Mary", "Patricia", "Jennifer", "Linda", "Elizabeth", "Barbara", "Susan", "Jessica", "Sarah", "Karen",
            "Nancy", "Lisa", "Betty", "Margaret", "Sandra", "Ashley", "Emily", "Michelle", "Maria", "Aisha");

    private static final List<String> LAST_NAMES = List.of(
            "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis", "Rodriguez", "Martinez",
            "Hernandez", "Lopez", "Gonzalez", "Wilson", "Anderson", "Thomas", "Taylor", "Moore", "Jackson", "Martin",
            "Lee", "Perez", "Thompson", "White", "Harris", "Sanchez", "Clark", "Nguyen", "Patel", "Kim");

    private static final List<String> STREET_NAMES = List.of(
            "Main St", "Oak Ave", "Maple Dr", "Cedar Ln", "Pine St", "Elm St", "Washington Ave", "Lake Rd",
            "Hillcrest Dr", "Park Blvd", "Sunset Ave", "River Rd");

    private static final List<Address> CITIES = List.of(
            new Address(null, "Springfield", "IL", "62701"),
            new Address(null, "Columbus", "OH", "43215"),
            new Address(null, "Austin", "TX", "78701"),
            new Address(null, "Denver", "CO", "80202"),
            new Address(null, "Portland", "OR", "97201"),
            new Address(null, "Raleigh", "NC", "27601"),
            new Address(null, "Madison", "WI", "53703"),
            new Address(null, "Tampa", "FL", "33602"),
            new Address(null, "Phoenix", "AZ", "85004"),
            new Address(null, "Richmond", "VA", "23219"));

    private final GenerationContext context;

    public DemographicsGenerator(GenerationContext context) {
        this.context = context;
    }

    public Demographics generate(AgeRange ageRange, Gender gender) {
        Gender resolved = gender != null ? gender : context.pick(Gender.values());
        return generate(ageRange, resolved, context.pick(LAST_NAMES));
    }

    /**
     * Same as {@link #generate(AgeRange, Gender)} but keeps a given family name.
     */
    public Demographics generate(AgeRange ageRange, Gender gender, String lastName) {
        Gender resolved = gender != null ? gender : context.pick(Gender.values());
        List<String> firstNames = resolved == Gender.M ? MALE_FIRST_NAMES : FEMALE_FIRST_NAMES;
        String firstName = context.pick(firstNames);
        String middleName = context.chance(0.6) ? context.pick(firstNames) : null;
        return new Demographics(
                firstName,
                middleName,
                lastName,
                birthDate(ageRange),
                resolved,
                address(),
                phone());
    }

    public LocalDate birthDate(AgeRange ageRange) {
        int age = context.between(ageRange.min(), ageRange.max());
        return context.today().minusYears(age).minusDays(context.nextInt(365));
    }

    public Address address() {
        Address city = context.pick(CITIES);
        String line1 = context.between(100, 9899) + " " + context.pick(STREET_NAMES);
        return new Address(line1, city.city(), city.state(), city.postalCode());
    }

    public String phone() {
        return String.format("(%d%s) %d%s-%s",
                context.between(2, 9), context.digits(2),
                context.between(2, 9), context.digits(2),
                context.digits(4));
    }

    public String lastName() {
        return context.pick(LAST_NAMES);
    }
}
