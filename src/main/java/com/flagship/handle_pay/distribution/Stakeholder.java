package com.flagship.handle_pay.distribution;

import com.flagship.handle_pay.asset.Address;
import lombok.Value;

/**
 * A fixed claimant on the distributor's holdings.
 */
@Value
public class Stakeholder {
    Address address;
    int shareBps;
}
