package com.bank.merchanttwin.seeder;

import com.bank.merchanttwin.engine.MerchantValidator;
import com.bank.merchanttwin.model.AccountStatus;
import com.bank.merchanttwin.model.KycStatus;
import com.bank.merchanttwin.model.Merchant;
import com.bank.merchanttwin.model.SimStatus;
import com.bank.merchanttwin.model.StartKeyStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Five hand-built merchants covering every failure profile at least once:
 * <ul>
 *   <li>M001 healthy, long-standing retail merchant</li>
 *   <li>M002 compounding failures: suspended, expired KYC, fresh SIM swap, locked PIN, corrupt start key</li>
 *   <li>M003 partial: KYC in review, one PIN attempt from lockout</li>
 *   <li>M004 frozen, dormant 95 days, expired start key</li>
 *   <li>M005 clean reference merchant</li>
 * </ul>
 */
@Component
public class MerchantRegistry {

    private final List<Merchant> merchants;

    public MerchantRegistry() {
        this.merchants = List.of(m001(), m002(), m003(), m004(), m005());
        merchants.forEach(MerchantValidator::validate);
    }

    public List<Merchant> merchants() {
        return merchants;
    }

    public Optional<Merchant> findById(String id) {
        return merchants.stream().filter(m -> m.getId().equals(id)).findFirst();
    }

    private static Merchant m001() {
        return Merchant.builder()
                .id("M001")
                .firstName("Kevin").middleName("Kithinji").lastName("Njoroge")
                .dateOfBirth("1990-03-15").gender("Male")
                .nationality("Kenyan").documentType("National ID").documentNumber("34521987")
                .phoneNumber("0704737162").email("kevin.njoroge@email.com")
                .county("Nairobi").city("Nairobi").physicalAddress("Roysambu, Nairobi")
                .postalAddress("110").postalCode("00100")
                .businessName("Njoroge General Store").businessCategory("Retail")
                .businessRegion("Nairobi").paybill("174379")
                .kraPin("A0098499583").certificateNumber("CRT99593")
                .product("Short Term Paybill").duration("6 months").applicationStatus("approved")
                .bank("Equity Bank").bankBranch("Kasarani").bankBranchCode("93884")
                .bankAccountName("Njoroge Store").bankAccount("0110399405862")
                .sourceOfFunds("Business income").purposeOfFunds("Business operations")
                .expectedTurnover("KES 500,000")
                .accountStatus(AccountStatus.ACTIVE).kycStatus(KycStatus.VERIFIED).kycAgeDays(180)
                .simStatus(SimStatus.ACTIVE).simSwapDaysAgo(null)
                .pinAttempts(0).pinLocked(false)
                .startKeyStatus(StartKeyStatus.VALID).balance(87450.50)
                .dormantDays(2).notificationsEnabled(true)
                .settlementOnHold(false).operatorDormantDays(2)
                .build();
    }

    private static Merchant m002() {
        return Merchant.builder()
                .id("M002")
                .firstName("Amara").middleName("Wanjiku").lastName("Kamau")
                .dateOfBirth("1985-07-22").gender("Female")
                .nationality("Kenyan").documentType("National ID").documentNumber("22145678")
                .phoneNumber("0711234567").email("amara.kamau@email.com")
                .county("Kiambu").city("Thika").physicalAddress("Thika Town, Kiambu")
                .postalAddress("45").postalCode("01000")
                .businessName("Kamau Hardware & Supplies").businessCategory("Hardware")
                .businessRegion("Central").paybill("522533")
                .kraPin("B0087654321").certificateNumber("CRT44123")
                .product("Short Term Paybill").duration("6 months").applicationStatus("suspended")
                .bank("KCB Bank").bankBranch("Thika").bankBranchCode("12345")
                .bankAccountName("Kamau Hardware").bankAccount("1234567890123")
                .sourceOfFunds("Business income").purposeOfFunds("Business operations")
                .expectedTurnover("KES 200,000")
                .accountStatus(AccountStatus.SUSPENDED).kycStatus(KycStatus.EXPIRED).kycAgeDays(420)
                .simStatus(SimStatus.SWAPPED).simSwapDaysAgo(5)
                .pinAttempts(3).pinLocked(true)
                .startKeyStatus(StartKeyStatus.INVALID).balance(32100.00)
                .dormantDays(60).notificationsEnabled(false)
                .settlementOnHold(true).operatorDormantDays(62)
                .build();
    }

    private static Merchant m003() {
        return Merchant.builder()
                .id("M003")
                .firstName("Fatuma").middleName("Akinyi").lastName("Odhiambo")
                .dateOfBirth("1993-11-08").gender("Female")
                .nationality("Kenyan").documentType("National ID").documentNumber("45678901")
                .phoneNumber("0722345678").email("fatuma.odhiambo@email.com")
                .county("Kisumu").city("Kisumu").physicalAddress("Milimani, Kisumu")
                .postalAddress("88").postalCode("40100")
                .businessName("Fatuma Beauty & Salon").businessCategory("Services")
                .businessRegion("Nyanza").paybill("700234")
                .kraPin("C0076543210").certificateNumber("CRT77890")
                .product("Short Term Paybill").duration("6 months").applicationStatus("pending")
                .bank("Cooperative Bank").bankBranch("Kisumu").bankBranchCode("44455")
                .bankAccountName("Fatuma Salon").bankAccount("9876543210987")
                .sourceOfFunds("Business income").purposeOfFunds("Salon operations")
                .expectedTurnover("KES 150,000")
                .accountStatus(AccountStatus.ACTIVE).kycStatus(KycStatus.PENDING).kycAgeDays(15)
                .simStatus(SimStatus.ACTIVE).simSwapDaysAgo(null)
                .pinAttempts(2).pinLocked(false)
                .startKeyStatus(StartKeyStatus.VALID).balance(5600.25)
                .dormantDays(0).notificationsEnabled(true)
                .settlementOnHold(false).operatorDormantDays(0)
                .build();
    }

    private static Merchant m004() {
        return Merchant.builder()
                .id("M004")
                .firstName("Brian").middleName("Kipchoge").lastName("Rotich")
                .dateOfBirth("1988-05-30").gender("Male")
                .nationality("Kenyan").documentType("National ID").documentNumber("56789012")
                .phoneNumber("0733456789").email("brian.rotich@email.com")
                .county("Uasin Gishu").city("Eldoret").physicalAddress("Huruma Estate, Eldoret")
                .postalAddress("200").postalCode("30100")
                .businessName("Rotich Electronics Hub").businessCategory("Electronics")
                .businessRegion("Rift Valley").paybill("303030")
                .kraPin("D0065432109").certificateNumber("CRT55678")
                .product("Short Term Paybill").duration("6 months").applicationStatus("frozen")
                .bank("Absa Bank").bankBranch("Eldoret").bankBranchCode("77766")
                .bankAccountName("Rotich Electronics").bankAccount("0987654321098")
                .sourceOfFunds("Business income").purposeOfFunds("Electronics retail")
                .expectedTurnover("KES 1,200,000")
                .accountStatus(AccountStatus.FROZEN).kycStatus(KycStatus.VERIFIED).kycAgeDays(390)
                .simStatus(SimStatus.ACTIVE).simSwapDaysAgo(null)
                .pinAttempts(0).pinLocked(false)
                .startKeyStatus(StartKeyStatus.EXPIRED).balance(234500.00)
                .dormantDays(95).notificationsEnabled(true)
                .settlementOnHold(true).operatorDormantDays(95)
                .build();
    }

    private static Merchant m005() {
        return Merchant.builder()
                .id("M005")
                .firstName("Grace").middleName("Muthoni").lastName("Waweru")
                .dateOfBirth("1995-02-14").gender("Female")
                .nationality("Kenyan").documentType("National ID").documentNumber("67890123")
                .phoneNumber("0744567890").email("grace.waweru@email.com")
                .county("Nakuru").city("Nakuru").physicalAddress("Section 58, Nakuru")
                .postalAddress("77").postalCode("20100")
                .businessName("Waweru Fresh Groceries").businessCategory("Grocery")
                .businessRegion("Rift Valley").paybill("899573")
                .kraPin("E0054321098").certificateNumber("CRT33456")
                .product("Short Term Paybill").duration("6 months").applicationStatus("approved")
                .bank("NCBA Bank").bankBranch("Nakuru").bankBranchCode("55566")
                .bankAccountName("Waweru Groceries").bankAccount("1122334455667")
                .sourceOfFunds("Business income").purposeOfFunds("Grocery operations")
                .expectedTurnover("KES 800,000")
                .accountStatus(AccountStatus.ACTIVE).kycStatus(KycStatus.VERIFIED).kycAgeDays(90)
                .simStatus(SimStatus.ACTIVE).simSwapDaysAgo(null)
                .pinAttempts(0).pinLocked(false)
                .startKeyStatus(StartKeyStatus.VALID).balance(12300.75)
                .dormantDays(0).notificationsEnabled(true)
                .settlementOnHold(false).operatorDormantDays(0)
                .build();
    }
}
