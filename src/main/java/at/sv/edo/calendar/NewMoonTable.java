package at.sv.edo.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable, ascending list of new moon instants read from a JSON array of ISO-8601 UTC timestamps.
 */
public final class NewMoonTable {

    private static final TypeReference<List<String>> TYPE_REF = new TypeReference<List<String>>() {
    };

    private final List<Instant> newMoons;

    public NewMoonTable(List<Instant> newMoons) {
        List<Instant> sorted = new ArrayList<>(newMoons);
        Collections.sort(sorted);
        this.newMoons = Collections.unmodifiableList(sorted);
    }

    /**
     * @throws InvalidReferenceData if the stream is no JSON array of strings or contains an invalid timestamp
     */
    public static NewMoonTable parse(InputStream inputStream) {
        ObjectMapper objectMapper = new ObjectMapper();
        List<String> values;
        try {
            values = objectMapper.readValue(inputStream, TYPE_REF);
        } catch (IOException e) {
            throw new InvalidReferenceData("Failed to read new moon data: " + e.getMessage(), e);
        }
        if (values == null) {
            throw new InvalidReferenceData("New moon data is empty");
        }
        List<Instant> newMoons = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            try {
                newMoons.add(Instant.parse(value));
            } catch (DateTimeParseException | NullPointerException e) {
                throw new InvalidReferenceData("Invalid new moon timestamp '" + value + "' at index " + i, e);
            }
        }
        return new NewMoonTable(newMoons);
    }

    /**
     * @return index of the greatest new moon not after the given instant, -1 if there is none
     */
    public int indexOfLatestNotAfter(Instant instant) {
        int index = Collections.binarySearch(newMoons, instant);
        if (index >= 0) {
            return index;
        }
        return -index - 2;
    }

    public Instant get(int index) {
        return newMoons.get(index);
    }

    public List<Instant> getNewMoons() {
        return newMoons;
    }

    public boolean isEmpty() {
        return newMoons.isEmpty();
    }

    public int size() {
        return newMoons.size();
    }

    /**
     * @throws NoSuchElementException if the table is empty
     */
    public Instant first() {
        if (newMoons.isEmpty()) {
            throw new NoSuchElementException("No new moons");
        }
        return newMoons.get(0);
    }

    /**
     * @throws NoSuchElementException if the table is empty
     */
    public Instant last() {
        if (newMoons.isEmpty()) {
            throw new NoSuchElementException("No new moons");
        }
        return newMoons.get(newMoons.size() - 1);
    }
}
