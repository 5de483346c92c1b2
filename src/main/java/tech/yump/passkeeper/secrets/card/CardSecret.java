package tech.yump.passkeeper.secrets.card;

public record CardSecret(
        String id,
        String name,
        String number,
        int month,
        int year,
        String cvc,
        String pin
) {
    @Override
    public String toString() {
        return "CardSecret[id=" + id + ", name=" + name + ", number=******, month=" + month
                + ", year=" + year + ", cvc=***, pin=****]";
    }
}
