package org.sputnikdev.bluetooth.proximity.impl;

import org.junit.Test;
import org.sputnikdev.bluetooth.proximity.BeaconIdentity;
import org.sputnikdev.bluetooth.proximity.BeaconSighting;
import org.sputnikdev.bluetooth.proximity.util.BeaconPayloads;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.sputnikdev.bluetooth.proximity.util.BeaconPayloads.UUID_A;

public class IBeaconDecoderTest {

    @Test
    public void testDecode() {
        byte[] payload = BeaconPayloads.iBeacon(UUID_A, 1, 2, -59);

        Optional<BeaconSighting> sighting = IBeaconDecoder.decode(payload, -70, 1000L);

        assertTrue(sighting.isPresent());
        assertEquals(new BeaconIdentity(UUID_A, 1, 2), sighting.get().getIdentity());
        assertEquals(-70, sighting.get().getRssi());
        assertEquals(-59, sighting.get().getTxPower());
        assertEquals(1000L, sighting.get().getTimestamp());
        assertEquals(DistanceEstimator.estimate(-70, -59), sighting.get().getRawDistance(), 0.0);
    }

    @Test
    public void testDecodeUnsignedNumbers() {
        byte[] payload = BeaconPayloads.iBeacon(UUID_A, 65535, 40000, -1);

        BeaconSighting sighting = IBeaconDecoder.decode(payload, -80, 0L).get();

        assertEquals(65535, sighting.getIdentity().getMajor());
        assertEquals(40000, sighting.getIdentity().getMinor());
        assertEquals(-1, sighting.getTxPower());
    }

    @Test
    public void testWrongCompanyId() {
        byte[] payload = BeaconPayloads.withCompanyId(BeaconPayloads.iBeacon(UUID_A, 1, 2), 0x0059);

        assertFalse(IBeaconDecoder.isBeaconRecord(payload));
        assertFalse(IBeaconDecoder.decode(payload, -70, 0L).isPresent());
    }

    @Test
    public void testWrongTypeCode() {
        byte[] payload = BeaconPayloads.iBeacon(UUID_A, 1, 2);
        payload[3] = 0x16;

        assertFalse(IBeaconDecoder.decode(payload, -70, 0L).isPresent());
    }

    @Test
    public void testWrongLength() {
        byte[] payload = BeaconPayloads.iBeacon(UUID_A, 1, 2);

        assertFalse(IBeaconDecoder.decode(Arrays.copyOf(payload, 24), -70, 0L).isPresent());
        assertFalse(IBeaconDecoder.decode(Arrays.copyOf(payload, 26), -70, 0L).isPresent());
        assertFalse(IBeaconDecoder.decode(new byte[0], -70, 0L).isPresent());
        assertFalse(IBeaconDecoder.decode(null, -70, 0L).isPresent());
    }

}
