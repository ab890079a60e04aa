package io.leadzpay.transport.http;

import io.leadzpay.domain.common.ErrorCode;
import io.leadzpay.domain.common.InvalidRequestException;
import io.leadzpay.domain.rating.CoverageType;
import io.leadzpay.domain.rating.CreditTier;
import io.leadzpay.domain.rating.RatingProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuoteRequestTest {

    private static QuoteRequest parse(String json) throws Exception {
        return HttpSupport.MAPPER.readValue(json, QuoteRequest.class);
    }

    @Test
    void testAbsentFieldsTakeDefaults() throws Exception {
        RatingProfile profile = parse("{\"carModel\":\"2020 Honda Accord\"}").toProfile();
        RatingProfile defaults = RatingProfile.defaults("2020 Honda Accord", null);

        assertEquals(defaults, profile);
        assertEquals(RatingProfile.DEFAULT_STATE, profile.state());
    }

    @Test
    void testWireNames() throws Exception {
        RatingProfile profile = parse("{\"carModel\":\"Honda Civic\",\"creditTier\":\"excellent\","
            + "\"coverageType\":\"liability\",\"age\":19,\"state\":\"MI\",\"homeOwner\":true}").toProfile();

        assertEquals(CreditTier.EXCELLENT, profile.creditTier());
        assertEquals(CoverageType.LIABILITY, profile.coverageType());
        assertEquals(19, profile.age());
        assertEquals("MI", profile.state());
        assertTrue(profile.homeOwner());
    }

    @Test
    void testCarModelRequired() throws Exception {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
            () -> parse("{\"carModel\":\"  \"}").toProfile());

        assertEquals(ErrorCode.INVALID_REQUEST, e.getCode());
    }

    @Test
    void testAgeRange() throws Exception {
        assertThrows(InvalidRequestException.class, () -> parse("{\"carModel\":\"Kia Rio\",\"age\":14}").toProfile());
        assertThrows(InvalidRequestException.class, () -> parse("{\"carModel\":\"Kia Rio\",\"age\":111}").toProfile());
    }
}
