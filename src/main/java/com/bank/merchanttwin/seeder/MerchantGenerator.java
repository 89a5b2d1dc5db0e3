package com.bank.merchanttwin.seeder;

import com.bank.merchanttwin.config.TwinProperties;
import com.bank.merchanttwin.engine.MerchantValidator;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.model.StartKeyStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Produces synthetic merchants whose sensor mix resembles the live fleet:
 * most merchants active and healthy, a minority with compounding failures.
 *
 * Output is fully determined by {@code twin.generator.seed}. Instances are not
 * meant to be shared between threads.
 */
@Component
public class MerchantGenerator {

    private static final String[] FIRST_NAMES = {
            "Wanjiru", "Otieno", "Mwangi", "Achieng", "Kamau", "Njeri", "Omondi", "Mutua", "Chebet", "Wairimu",
            "Kiptoo", "Auma", "Karanja", "Adhiambo", "Ndung'u", "Moraa", "Kiprotich", "Nyambura", "Odhiambo", "Gathoni"
    };
    private static final String[] LAST_NAMES = {
            "Njoroge", "Kamau", "Odhiambo", "Rotich", "Waweru", "Kariuki", "Otieno", "Muthoni", "Koech", "Kimani",
            "Akinyi", "Wekesa", "Gichuki", "Simiyu", "Muigai", "Jeptoo", "Muriithi", "Onyango", "Barasa", "Kinyua"
    };
    private static final String[] BUSINESSES = {
            "Supermarket", "Hardware", "Pharmacy", "Electronics", "Salon", "Boutique", "Bookshop", "Restaurant",
            "Bakery", "Chemist", "Agrovet", "Butchery", "Cybercafe", "M-PESA Agent", "Stationery"
    };
    private static final String[] COUNTIES = {
            "Nairobi", "Mombasa", "Kisumu", "Nakuru", "Eldoret", "Thika", "Kiambu", "Machakos", "Nyeri", "Meru"
    };
    private static final String[] BANKS = {
            "Equity Bank", "KCB Bank", "Cooperative Bank", "NCBA Bank", "Absa Bank", "Standard Chartered",
            "DTB Bank", "Family Bank", "Prime Bank"
    };
    private static final String[] KRA_PREFIXES = {"A", "B", "C", "D", "E"};
    private static final String ID_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final Random random;
    private final Clock clock;
    private final Set<String> issuedIds = new HashSet<>();

    public MerchantGenerator(TwinProperties properties, Clock clock) {
        this.random = new Random(properties.getGenerator().getSeed());
        this.clock = clock;
    }

    public Merchant generateMerchant() {
        return generateMerchant(UnaryOperator.identity());
    }

    /**
     * @param overrides applied to the generated builder before the snapshot is
     *                  validated, so an override that breaks an invariant is rejected
     */
    public Merchant generateMerchant(UnaryOperator<Merchant.MerchantBuilder> overrides) {
        String firstName = pick(FIRST_NAMES);
        String lastName = pick(LAST_NAMES);
        String bizType = pick(BUSINESSES);
        String county = pick(COUNTIES);

        AccountStatus accountStatus = weightedPick(
                new AccountStatus[]{AccountStatus.ACTIVE, AccountStatus.SUSPENDED, AccountStatus.FROZEN},
                0.65, 0.25, 0.10);

        KycStatus kycStatus = weightedPick(
                new KycStatus[]{KycStatus.VERIFIED, KycStatus.PENDING, KycStatus.EXPIRED},
                0.60, 0.20, 0.20);
        int kycAgeDays;
        switch (kycStatus) {
            case EXPIRED:
                kycAgeDays = randInt(366, 500);
                break;
            case PENDING:
                kycAgeDays = randInt(1, 30);
                break;
            default:
                kycAgeDays = randInt(30, 364);
        }

        SimStatus simStatus = weightedPick(
                new SimStatus[]{SimStatus.ACTIVE, SimStatus.SWAPPED, SimStatus.UNREGISTERED},
                0.75, 0.20, 0.05);
        Integer simSwapDaysAgo = simStatus == SimStatus.SWAPPED ? randInt(1, 60) : null;

        int pinAttempts = weightedPick(new Integer[]{0, 1, 2, 3}, 0.55, 0.20, 0.15, 0.10);

        StartKeyStatus startKeyStatus = weightedPick(
                new StartKeyStatus[]{StartKeyStatus.VALID, StartKeyStatus.INVALID, StartKeyStatus.EXPIRED},
                0.65, 0.20, 0.15);

        int dormantBucket = weightedPick(new Integer[]{0, 1, 2, 3}, 0.55, 0.20, 0.15, 0.10);
        int dormantDays;
        switch (dormantBucket) {
            case 0:
                dormantDays = randInt(0, 29);
                break;
            case 1:
                dormantDays = randInt(30, 59);
                break;
            case 2:
                dormantDays = randInt(60, 89);
                break;
            default:
                dormantDays = randInt(90, 150);
        }
        int operatorDormantDays = Math.max(0, dormantDays + randInt(-10, 10));

        int balanceBucket = weightedPick(new Integer[]{0, 1, 2, 3}, 0.05, 0.30, 0.45, 0.20);
        double balance;
        switch (balanceBucket) {
            case 0:
                balance = 0;
                break;
            case 1:
                balance = randInt(100, 5000);
                break;
            case 2:
                balance = randInt(5001, 50000);
                break;
            default:
                balance = randInt(50001, 500000);
        }

        boolean notificationsEnabled = random.nextDouble() > 0.20;
        boolean settlementOnHold = accountStatus != AccountStatus.ACTIVE
                ? random.nextDouble() > 0.40
                : random.nextDouble() > 0.90;

        Merchant.MerchantBuilder builder = Merchant.builder()
                .id(nextId())
                .firstName(firstName)
                .middleName(pick(FIRST_NAMES))
                .lastName(lastName)
                .dateOfBirth(String.format(Locale.US, "%d-%02d-%02d",
                        randInt(1970, 2000), randInt(1, 12), randInt(1, 28)))
                .gender(random.nextBoolean() ? "Male" : "Female")
                .nationality("Kenyan")
                .documentType("National ID")
                .documentNumber(String.valueOf(randInt(10000000, 99999999)))
                .phoneNumber("07" + randInt(10, 99) + randInt(100000, 999999))
                .email(normalize(firstName) + "." + normalize(lastName) + "@email.com")
                .county(county)
                .city(county)
                .physicalAddress(county + " Town, " + county)
                .postalAddress(String.valueOf(randInt(1, 999)))
                .postalCode(String.valueOf(randInt(10000, 99999)))
                .businessName(lastName + " " + bizType)
                .businessCategory(bizType)
                .businessRegion(county)
                .paybill(String.valueOf(randInt(100000, 999999)))
                .kraPin(pick(KRA_PREFIXES) + randLong(1_000_000_000L, 9_999_999_999L))
                .certificateNumber("CRT" + randInt(10000, 99999))
                .product("Short Term Paybill")
                .duration(weightedPick(new String[]{"3 months", "6 months", "12 months"}, 0.20, 0.60, 0.20))
                .applicationStatus(applicationStatus(accountStatus))
                .bank(pick(BANKS))
                .bankBranch(county)
                .bankBranchCode(String.valueOf(randInt(10000, 99999)))
                .bankAccountName(lastName + " " + bizType)
                .bankAccount(String.valueOf(randLong(1_000_000_000_000L, 9_999_999_999_999L)))
                .sourceOfFunds("Business income")
                .purposeOfFunds("Business operations")
                .expectedTurnover(String.format(Locale.US, "KES %,d", randInt(50, 2000) * 1000))
                .accountStatus(accountStatus)
                .kycStatus(kycStatus)
                .kycAgeDays(kycAgeDays)
                .simStatus(simStatus)
                .simSwapDaysAgo(simSwapDaysAgo)
                .pinAttempts(pinAttempts)
                .pinLocked(pinAttempts >= MerchantValidator.MAX_PIN_ATTEMPTS)
                .startKeyStatus(startKeyStatus)
                .balance(balance)
                .dormantDays(dormantDays)
                .operatorDormantDays(operatorDormantDays)
                .notificationsEnabled(notificationsEnabled)
                .settlementOnHold(settlementOnHold)
                .generated(true)
                .generatedAt(clock.instant());

        return MerchantValidator.validate(overrides.apply(builder).build());
    }

    public List<Merchant> generateBatch(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Batch size must be >= 0, got " + n);
        }
        List<Merchant> batch = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            batch.add(generateMerchant());
        }
        return batch;
    }

    private static String applicationStatus(AccountStatus status) {
        switch (status) {
            case ACTIVE:
                return "approved";
            case SUSPENDED:
                return "suspended";
            default:
                return "frozen";
        }
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("'", "");
    }

    private String nextId() {
        String id;
        do {
            StringBuilder sb = new StringBuilder("GEN-");
            for (int i = 0; i < 5; i++) {
                sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
            }
            id = sb.toString();
        } while (!issuedIds.add(id));
        return id;
    }

    private <T> T weightedPick(T[] options, double... weights) {
        double r = random.nextDouble();
        double sum = 0;
        for (int i = 0; i < options.length; i++) {
            sum += weights[i];
            if (r <= sum) {
                return options[i];
            }
        }
        return options[options.length - 1];
    }

    private <T> T pick(T[] options) {
        return options[random.nextInt(options.length)];
    }

    // inclusive on both ends
    private int randInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private long randLong(long min, long max) {
        return min + (long) (random.nextDouble() * (max - min + 1));
    }
}
